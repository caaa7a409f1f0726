package com.ryuqq.cutover.migration.parity;

import java.util.List;

/**
 * 조직 하나의 비교 결과 (불변 record).
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param orgSlug 조직 slug
 * @param status 비교 결과
 * @param diffPaths 다른 위치 (JSON Pointer 또는 누락된 DateIndex 키, 최대 개수 제한)
 */
public record ParityResult(String orgSlug, ParityStatus status, List<String> diffPaths) {

    public ParityResult {
        if (orgSlug == null) {
            throw new IllegalArgumentException("orgSlug cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        diffPaths = diffPaths == null ? List.of() : List.copyOf(diffPaths);
    }

    public static ParityResult of(String orgSlug, ParityStatus status) {
        return new ParityResult(orgSlug, status, List.of());
    }

    public boolean isMatch() {
        return status == ParityStatus.MATCH;
    }

    @Override
    public String toString() {
        return diffPaths.isEmpty()
            ? orgSlug + ": " + status
            : orgSlug + ": " + status + " " + diffPaths;
    }
}
