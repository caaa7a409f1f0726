package com.ryuqq.cutover.migration.parity;

/**
 * 조직 하나의 비교 결과.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum ParityStatus {

    MATCH,

    /**
     * 두 문서가 다르거나 DateIndex 항목이 Primary에 없음.
     */
    MISMATCH,

    MISSING_IN_PRIMARY,

    MISSING_IN_LEGACY
}
