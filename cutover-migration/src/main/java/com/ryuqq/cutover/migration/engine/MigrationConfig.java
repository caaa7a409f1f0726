package com.ryuqq.cutover.migration.engine;

import com.ryuqq.cutover.migration.schema.DocumentNormalizer;

import java.util.List;
import java.util.TreeSet;

/**
 * Migration 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>dryRun: 쓰기 계획만 출력, put 호출과 체크포인트 변경 없음 (기본 false)</li>
 *   <li>resume: 체크포인트에 완료된 조직은 건너뜀 (기본 false)</li>
 *   <li>concurrency: 동시에 처리할 조직 수 (기본 2)</li>
 *   <li>organizations: 대상 조직 제한 (비어 있으면 Registry 전체)</li>
 *   <li>upgradeSchema: 조직 문서를 최신 schemaVersion으로 업그레이드해서 씀 (기본 false)</li>
 *   <li>repair: 고칠 수 있는 구조 결함을 복구해서 씀 (기본 false)</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param dryRun dry-run 여부
 * @param resume 이어하기 여부
 * @param concurrency 동시 처리 수 (1 이상)
 * @param organizations 대상 조직 slug (정렬, 중복 제거)
 * @param upgradeSchema schema 업그레이드 여부
 * @param repair 구조 복구 여부
 */
public record MigrationConfig(
    boolean dryRun,
    boolean resume,
    int concurrency,
    List<String> organizations,
    boolean upgradeSchema,
    boolean repair
) {

    public static final int DEFAULT_CONCURRENCY = 2;

    /**
     * 기본 설정 생성자.
     */
    public MigrationConfig() {
        this(false, false, DEFAULT_CONCURRENCY, List.of(), false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MigrationConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        organizations = organizations == null ? List.of() : List.copyOf(new TreeSet<>(organizations));
    }

    /**
     * dryRun만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withDryRun(boolean dryRun) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * resume만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withResume(boolean resume) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withConcurrency(int concurrency) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * organizations만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withOrganizations(List<String> organizations) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * upgradeSchema만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withUpgradeSchema(boolean upgradeSchema) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * repair만 변경한 새 인스턴스 생성.
     */
    public MigrationConfig withRepair(boolean repair) {
        return new MigrationConfig(dryRun, resume, concurrency, organizations, upgradeSchema, repair);
    }

    /**
     * 이 설정의 문서 정규화.
     */
    public DocumentNormalizer normalizer() {
        return upgradeSchema || repair ? new DocumentNormalizer(upgradeSchema, repair) : DocumentNormalizer.NONE;
    }
}
