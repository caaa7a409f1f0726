package com.ryuqq.cutover.migration.parity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parity 실행 결과 (불변 record).
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param results 조직별 결과 (샘플 순서)
 */
public record ParityReport(List<ParityResult> results) {

    public ParityReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * 상태별 조직 수.
     */
    public Map<ParityStatus, Integer> counts() {
        Map<ParityStatus, Integer> counts = new EnumMap<>(ParityStatus.class);
        for (ParityStatus status : ParityStatus.values()) {
            counts.put(status, 0);
        }
        results.forEach(r -> counts.merge(r.status(), 1, Integer::sum));
        return counts;
    }

    public boolean allMatch() {
        return results.stream().allMatch(ParityResult::isMatch);
    }

    public String summary() {
        Map<ParityStatus, Integer> counts = counts();
        return String.format("sampled=%d, match=%d, mismatch=%d, missingInPrimary=%d, missingInLegacy=%d",
            results.size(),
            counts.get(ParityStatus.MATCH),
            counts.get(ParityStatus.MISMATCH),
            counts.get(ParityStatus.MISSING_IN_PRIMARY),
            counts.get(ParityStatus.MISSING_IN_LEGACY));
    }
}
