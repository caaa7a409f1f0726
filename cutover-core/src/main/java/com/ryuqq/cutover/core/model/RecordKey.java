package com.ryuqq.cutover.core.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * 저장 레코드의 복합 키.
 *
 * <p>RecordKey는 (Table, PartitionKey, RowKey) 조합으로 구성되며,
 * 백엔드에서는 (partition-key, row-key) 쌍으로 그대로 매핑됩니다.</p>
 *
 * <p><strong>키 설계:</strong></p>
 * <pre>
 * registry       / app        / config          → Registry singleton
 * registry       / directory  / {orgSlug}        → 조직 디렉터리 projection
 * organizations  / {orgSlug}  / org              → Organization 문서
 * date-index     / YYYY-MM-DD / {orgSlug}:{huntId} → DateIndex 항목
 * </pre>
 *
 * @param table 테이블
 * @param partitionKey 파티션 키 (공백 불가)
 * @param rowKey 로우 키 (공백 불가)
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record RecordKey(
    Table table,
    String partitionKey,
    String rowKey
) implements Comparable<RecordKey> {

    public static final String REGISTRY_PARTITION = "app";
    public static final String REGISTRY_ROW = "config";
    public static final String DIRECTORY_PARTITION = "directory";
    public static final String ORGANIZATION_ROW = "org";

    private static final Comparator<RecordKey> ORDER = Comparator
        .comparing(RecordKey::table)
        .thenComparing(RecordKey::partitionKey)
        .thenComparing(RecordKey::rowKey);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 공백인 경우
     */
    public RecordKey {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        if (partitionKey == null || partitionKey.isBlank()) {
            throw new IllegalArgumentException("partitionKey cannot be null or blank");
        }
        if (rowKey == null || rowKey.isBlank()) {
            throw new IllegalArgumentException("rowKey cannot be null or blank");
        }
    }

    /**
     * Registry singleton 키.
     *
     * @return 고정 키 (registry/app/config)
     */
    public static RecordKey registry() {
        return new RecordKey(Table.REGISTRY, REGISTRY_PARTITION, REGISTRY_ROW);
    }

    /**
     * 조직 디렉터리 projection 키.
     *
     * @param orgSlug 조직 slug
     * @return registry/directory/{orgSlug}
     */
    public static RecordKey directoryEntry(String orgSlug) {
        return new RecordKey(Table.REGISTRY, DIRECTORY_PARTITION, orgSlug);
    }

    /**
     * Organization 문서 키.
     *
     * @param orgSlug 조직 slug
     * @return organizations/{orgSlug}/org
     */
    public static RecordKey organization(String orgSlug) {
        return new RecordKey(Table.ORGANIZATIONS, orgSlug, ORGANIZATION_ROW);
    }

    /**
     * DateIndex 항목 키.
     *
     * @param date 날짜
     * @param orgSlug 조직 slug
     * @param huntId hunt ID
     * @return date-index/{date}/{orgSlug}:{huntId}
     * @throws IllegalArgumentException date가 null인 경우
     */
    public static RecordKey dateIndex(LocalDate date, String orgSlug, String huntId) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return new RecordKey(Table.DATE_INDEX, date.toString(), orgSlug + ":" + huntId);
    }

    @Override
    public int compareTo(RecordKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return table.tableName() + "/" + partitionKey + "/" + rowKey;
    }
}
