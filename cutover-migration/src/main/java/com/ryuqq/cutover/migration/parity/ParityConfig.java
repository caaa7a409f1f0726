package com.ryuqq.cutover.migration.parity;

import com.ryuqq.cutover.migration.schema.DocumentNormalizer;

import java.util.Set;

/**
 * Parity Checker 설정 (불변 record).
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param sampleSize 비교할 조직 수 (양수)
 * @param seed 셔플 seed (null이면 정렬 순서로 앞에서부터)
 * @param ignoredFields 비교에서 제외할 필드 이름 (모든 깊이)
 * @param maxDiffPaths 결과에 기록할 차이 경로 최대 개수
 * @param upgradeSchema 비교 전 Legacy 문서를 최신 schemaVersion으로 업그레이드 (Migration과 같은 설정으로)
 * @param repair 비교 전 Legacy 문서의 구조 결함 복구 (Migration과 같은 설정으로)
 */
public record ParityConfig(
    int sampleSize,
    Long seed,
    Set<String> ignoredFields,
    int maxDiffPaths,
    boolean upgradeSchema,
    boolean repair
) {

    public static final int DEFAULT_SAMPLE_SIZE = 20;
    public static final int DEFAULT_MAX_DIFF_PATHS = 10;
    public static final Set<String> DEFAULT_IGNORED_FIELDS = Set.of("updatedAt", "etag");

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public ParityConfig {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive (current: " + sampleSize + ")");
        }
        if (ignoredFields == null) {
            throw new IllegalArgumentException("ignoredFields cannot be null");
        }
        if (maxDiffPaths <= 0) {
            throw new IllegalArgumentException("maxDiffPaths must be positive (current: " + maxDiffPaths + ")");
        }
        ignoredFields = Set.copyOf(ignoredFields);
    }

    /**
     * 기본 설정 (20개, 정렬 순서, updatedAt/etag 제외).
     */
    public ParityConfig() {
        this(DEFAULT_SAMPLE_SIZE, null, DEFAULT_IGNORED_FIELDS, DEFAULT_MAX_DIFF_PATHS, false, false);
    }

    public ParityConfig withSampleSize(int sampleSize) {
        return new ParityConfig(sampleSize, seed, ignoredFields, maxDiffPaths, upgradeSchema, repair);
    }

    public ParityConfig withSeed(Long seed) {
        return new ParityConfig(sampleSize, seed, ignoredFields, maxDiffPaths, upgradeSchema, repair);
    }

    public ParityConfig withIgnoredFields(Set<String> ignoredFields) {
        return new ParityConfig(sampleSize, seed, ignoredFields, maxDiffPaths, upgradeSchema, repair);
    }

    public ParityConfig withUpgradeSchema(boolean upgradeSchema) {
        return new ParityConfig(sampleSize, seed, ignoredFields, maxDiffPaths, upgradeSchema, repair);
    }

    public ParityConfig withRepair(boolean repair) {
        return new ParityConfig(sampleSize, seed, ignoredFields, maxDiffPaths, upgradeSchema, repair);
    }

    /**
     * Legacy 문서에 적용할 정규화.
     */
    public DocumentNormalizer normalizer() {
        return upgradeSchema || repair ? new DocumentNormalizer(upgradeSchema, repair) : DocumentNormalizer.NONE;
    }
}
