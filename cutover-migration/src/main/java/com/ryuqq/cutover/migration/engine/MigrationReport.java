package com.ryuqq.cutover.migration.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Migration 실행 결과 (불변 record).
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param dryRun dry-run 실행 여부
 * @param registryCopied 이번 실행에서 Registry singleton을 복사했는지 여부
 * @param migrated 이번 실행에서 완료된 조직
 * @param alreadyDone 체크포인트에 이미 완료로 기록된 조직
 * @param skipped 검증 실패 또는 Legacy에 없어 건너뛴 조직과 사유
 * @param failed 백엔드 오류로 실패한 조직과 사유
 * @param notDispatched 취소로 시작하지 않은 조직
 * @param plannedWrites dry-run에서 계획된 쓰기 (키 순)
 * @param cancelled 취소 여부
 */
public record MigrationReport(
    boolean dryRun,
    boolean registryCopied,
    List<String> migrated,
    List<String> alreadyDone,
    Map<String, String> skipped,
    Map<String, String> failed,
    List<String> notDispatched,
    List<PlannedWrite> plannedWrites,
    boolean cancelled
) {

    /**
     * 건너뛰거나 실패한 조직 없이 끝까지 실행되었는지 여부.
     */
    public boolean isSuccess() {
        return skipped.isEmpty() && failed.isEmpty() && !cancelled;
    }

    /**
     * 한 줄 요약.
     */
    public String summary() {
        return String.format(
            "%smigrated=%d, alreadyDone=%d, skipped=%d, failed=%d, plannedWrites=%d, cancelled=%s",
            dryRun ? "[dry-run] " : "",
            migrated.size(), alreadyDone.size(), skipped.size(), failed.size(), plannedWrites.size(), cancelled
        );
    }

    static Builder builder(boolean dryRun) {
        return new Builder(dryRun);
    }

    /**
     * worker 스레드가 동시에 기록하는 누적기.
     */
    static final class Builder {

        private final boolean dryRun;
        private boolean registryCopied;
        private final List<String> migrated = new ArrayList<>();
        private final List<String> alreadyDone = new ArrayList<>();
        private final Map<String, String> skipped = new TreeMap<>();
        private final Map<String, String> failed = new TreeMap<>();
        private final List<String> notDispatched = new ArrayList<>();
        private final List<PlannedWrite> plannedWrites = new ArrayList<>();
        private boolean cancelled;

        private Builder(boolean dryRun) {
            this.dryRun = dryRun;
        }

        synchronized void registryCopied() {
            registryCopied = true;
        }

        synchronized void migrated(String orgSlug) {
            migrated.add(orgSlug);
        }

        synchronized void alreadyDone(String orgSlug) {
            alreadyDone.add(orgSlug);
        }

        synchronized void skipped(String orgSlug, String reason) {
            skipped.put(orgSlug, reason);
        }

        synchronized void failed(String orgSlug, String reason) {
            failed.put(orgSlug, reason);
        }

        synchronized void notDispatched(String orgSlug) {
            notDispatched.add(orgSlug);
        }

        synchronized void planned(List<PlannedWrite> writes) {
            plannedWrites.addAll(writes);
        }

        synchronized void cancelled() {
            cancelled = true;
        }

        synchronized MigrationReport build() {
            List<PlannedWrite> planned = new ArrayList<>(plannedWrites);
            planned.sort(Comparator.comparing(PlannedWrite::key));
            return new MigrationReport(
                dryRun,
                registryCopied,
                sorted(migrated),
                sorted(alreadyDone),
                Collections.unmodifiableMap(new TreeMap<>(skipped)),
                Collections.unmodifiableMap(new TreeMap<>(failed)),
                sorted(notDispatched),
                List.copyOf(planned),
                cancelled
            );
        }

        private static List<String> sorted(List<String> values) {
            List<String> copy = new ArrayList<>(values);
            copy.sort(Comparator.naturalOrder());
            return List.copyOf(copy);
        }
    }
}
