package com.ryuqq.cutover.core.model;

/**
 * 범위 조회(query)용 키 접두사.
 *
 * <p>한 테이블 안에서 partitionKey가 주어진 접두사로 시작하는 레코드를 선택합니다.
 * 빈 접두사는 테이블 전체를 의미합니다.</p>
 *
 * @param table 테이블
 * @param partitionPrefix partitionKey 접두사 (빈 문자열 허용, null 불가)
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record KeyPrefix(
    Table table,
    String partitionPrefix
) {

    public KeyPrefix {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        if (partitionPrefix == null) {
            throw new IllegalArgumentException("partitionPrefix cannot be null");
        }
    }

    /**
     * 테이블 전체.
     */
    public static KeyPrefix allOf(Table table) {
        return new KeyPrefix(table, "");
    }

    /**
     * 하나의 파티션.
     *
     * <p>접두사 매칭이므로 날짜 파티션(YYYY-MM-DD)처럼 길이가 고정된 키에 사용합니다.</p>
     */
    public static KeyPrefix partition(Table table, String partitionKey) {
        return new KeyPrefix(table, partitionKey);
    }

    /**
     * 키가 이 접두사에 해당하는지 확인.
     *
     * @param key 레코드 키
     * @return 같은 테이블이고 partitionKey가 접두사로 시작하면 true
     */
    public boolean matches(RecordKey key) {
        return key != null
            && key.table() == table
            && key.partitionKey().startsWith(partitionPrefix);
    }
}
