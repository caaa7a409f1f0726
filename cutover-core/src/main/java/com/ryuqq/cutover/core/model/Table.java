package com.ryuqq.cutover.core.model;

/**
 * 논리 레코드 종류별 저장 테이블.
 *
 * <p>두 저장소(Primary, Legacy) 모두 동일한 테이블 구분을 사용합니다.
 * 테이블 이름은 백엔드의 물리 이름(디렉터리, 테이블 접두사 등)으로 쓰입니다.</p>
 *
 * <ul>
 *   <li>{@link #REGISTRY}: 전역 설정 singleton 및 조직 디렉터리 projection</li>
 *   <li>{@link #ORGANIZATIONS}: 조직별 문서 (프로필 + hunts)</li>
 *   <li>{@link #DATE_INDEX}: 날짜별 hunt 조회 인덱스</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum Table {

    REGISTRY("registry"),

    ORGANIZATIONS("organizations"),

    DATE_INDEX("date-index");

    private final String tableName;

    Table(String tableName) {
        this.tableName = tableName;
    }

    /**
     * 물리 테이블 이름 조회.
     *
     * @return 테이블 이름 (소문자, 하이픈 허용)
     */
    public String tableName() {
        return tableName;
    }

    /**
     * 물리 테이블 이름으로 Table 조회.
     *
     * @param tableName 테이블 이름
     * @return Table
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static Table fromTableName(String tableName) {
        for (Table table : values()) {
            if (table.tableName.equals(tableName)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown table name: " + tableName);
    }
}
