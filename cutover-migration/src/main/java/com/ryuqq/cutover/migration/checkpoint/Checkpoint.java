package com.ryuqq.cutover.migration.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

/**
 * Migration 진행 상태 (불변 record).
 *
 * <p>완료된 조직 slug 목록과 Registry 복사 여부를 기록합니다. 파일 형식:</p>
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "runStartedAt": "2024-05-01T09:00:00Z",
 *   "updatedAt": "2024-05-01T09:03:12Z",
 *   "registryCopied": true,
 *   "completedOrganizations": ["acme", "globex"]
 * }
 * </pre>
 *
 * <p>읽을 때 알 수 없는 필드는 무시합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param formatVersion 파일 형식 버전
 * @param runStartedAt 최초 실행 시각
 * @param updatedAt 마지막 갱신 시각
 * @param registryCopied Registry singleton 복사 완료 여부
 * @param completedOrganizations 완료된 조직 slug (정렬, 중복 없음)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
    int formatVersion,
    String runStartedAt,
    String updatedAt,
    boolean registryCopied,
    List<String> completedOrganizations
) {

    public static final int CURRENT_FORMAT_VERSION = 1;

    /**
     * Compact constructor (완료 목록 정규화).
     */
    public Checkpoint {
        completedOrganizations = completedOrganizations == null
            ? List.of()
            : List.copyOf(new TreeSet<>(completedOrganizations));
    }

    /**
     * 새 실행의 빈 체크포인트.
     *
     * @param now 실행 시작 시각
     * @return Checkpoint
     */
    public static Checkpoint start(Instant now) {
        return new Checkpoint(CURRENT_FORMAT_VERSION, now.toString(), now.toString(), false, List.of());
    }

    /**
     * 조직 완료 여부.
     */
    public boolean isCompleted(String orgSlug) {
        return completedOrganizations.contains(orgSlug);
    }

    /**
     * 완료 조직을 추가한 새 인스턴스 생성.
     */
    public Checkpoint withCompleted(String orgSlug, Instant now) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        TreeSet<String> next = new TreeSet<>(completedOrganizations);
        next.add(orgSlug);
        return new Checkpoint(formatVersion, runStartedAt, now.toString(), registryCopied, List.copyOf(next));
    }

    /**
     * Registry 복사 완료를 기록한 새 인스턴스 생성.
     */
    public Checkpoint withRegistryCopied(Instant now) {
        return new Checkpoint(formatVersion, runStartedAt, now.toString(), true, completedOrganizations);
    }
}
