package com.ryuqq.cutover.migration.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.application.document.Documents;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreException;
import com.ryuqq.cutover.migration.checkpoint.Checkpoint;
import com.ryuqq.cutover.migration.checkpoint.CheckpointException;
import com.ryuqq.cutover.migration.checkpoint.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Migration/Backfill Engine.
 *
 * <p>Legacy 저장소의 Registry와 조직 문서를 읽어 Primary 저장소로 복사합니다.
 * 모든 쓰기는 {@link ExpectedVersion#any()}이므로 반복 실행해도 결과가 같습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(config)
 *   ↓
 * 1. Legacy Registry 읽기 → 조직 slug 정렬
 * 2. 체크포인트 로드 (resume) 또는 초기화
 * 3. Registry singleton 복사 (체크포인트당 한 번)
 * 4. 조직별 worker 실행 (Semaphore로 동시 실행 수 제한):
 *    - Legacy 조직 문서 읽기 → 검증 → 쓰기 목록 생성
 *    - dry-run: 계획만 기록
 *    - 그 외: Primary에 쓰기 → 체크포인트에 완료 기록
 * 5. 실행 중인 worker 종료 대기 → MigrationReport
 * </pre>
 *
 * <p><strong>취소:</strong> {@link #cancel()} 이후에는 새 조직을 시작하지 않으며,
 * 이미 시작한 조직은 끝까지 처리하고 체크포인트에 기록합니다.</p>
 *
 * <p><strong>MDC:</strong> worker는 {@code org_slug}를 설정합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class MigrationEngine {

    private static final Logger log = LoggerFactory.getLogger(MigrationEngine.class);

    public static final String MDC_ORG_SLUG = "org_slug";

    private final StoreAdapter legacy;
    private final StoreAdapter primary;
    private final CheckpointStore checkpointStore;
    private final ObjectMapper objectMapper;
    private final WritePlanner planner;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * 생성자 (기본 ObjectMapper, UTC clock).
     *
     * @param legacy 원본 저장소
     * @param primary 대상 저장소
     * @param checkpointStore 체크포인트 저장소
     */
    public MigrationEngine(StoreAdapter legacy, StoreAdapter primary, CheckpointStore checkpointStore) {
        this(legacy, primary, checkpointStore, Documents.objectMapper(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public MigrationEngine(
        StoreAdapter legacy,
        StoreAdapter primary,
        CheckpointStore checkpointStore,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.legacy = legacy;
        this.primary = primary;
        this.checkpointStore = checkpointStore;
        this.objectMapper = objectMapper;
        this.planner = new WritePlanner(objectMapper);
        this.clock = clock;
    }

    /**
     * Migration 실행.
     *
     * @param config 실행 설정
     * @return 실행 결과
     * @throws com.ryuqq.cutover.core.spi.StoreUnavailableException Legacy Registry를 읽을 수 없는 경우
     * @throws RecordValidationException Legacy Registry 형식이 잘못된 경우
     * @throws CheckpointException 체크포인트를 읽거나 초기화할 수 없는 경우
     */
    public MigrationReport run(MigrationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        CorrelationId correlationId = CorrelationId.newId();
        MigrationReport.Builder report = MigrationReport.builder(config.dryRun());

        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            log.info("Migration started: legacy={}, primary={}, dryRun={}, resume={}, concurrency={}",
                legacy.name(), primary.name(), config.dryRun(), config.resume(), config.concurrency());

            // 1. Legacy Registry 읽기
            Optional<StoredRecord> registryRecord = legacy.get(RecordKey.registry(), correlationId);
            LegacyRegistry registry = registryRecord
                .map(record -> LegacyRegistry.parse(record.payload(), objectMapper))
                .orElseGet(() -> {
                    log.warn("Legacy registry {} not found", RecordKey.registry());
                    return LegacyRegistry.empty();
                });
            List<String> slugs = config.organizations().isEmpty()
                ? registry.organizationSlugs()
                : config.organizations();

            // 2. 체크포인트
            Checkpoint checkpoint = loadCheckpoint(config);

            // 3. Registry singleton 복사
            if (registryRecord.isPresent() && !checkpoint.registryCopied()) {
                checkpoint = copyRegistry(registryRecord.get(), config, checkpoint, report, correlationId);
            }

            // 4. 조직별 처리
            dispatch(slugs, registry, checkpoint, config, report, correlationId);
        }

        MigrationReport result = report.build();
        log.info("Migration finished: {}", result.summary());
        return result;
    }

    /**
     * 새 조직 시작을 중단.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Migration cancel requested, waiting for in-flight organizations");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private Checkpoint loadCheckpoint(MigrationConfig config) {
        if (config.resume()) {
            Optional<Checkpoint> stored = checkpointStore.load();
            stored.ifPresent(c -> log.info("Resuming from checkpoint: {} organizations completed, registryCopied={}",
                c.completedOrganizations().size(), c.registryCopied()));
            return stored.orElseGet(() -> Checkpoint.start(clock.instant()));
        }
        Checkpoint fresh = Checkpoint.start(clock.instant());
        if (!config.dryRun()) {
            checkpointStore.save(fresh);
        }
        return fresh;
    }

    private Checkpoint copyRegistry(
        StoredRecord registryRecord,
        MigrationConfig config,
        Checkpoint checkpoint,
        MigrationReport.Builder report,
        CorrelationId correlationId
    ) {
        PlannedWrite write = new PlannedWrite(RecordKey.registry(), registryRecord.payload());
        if (config.dryRun()) {
            report.planned(List.of(write));
            return checkpoint;
        }
        primary.put(write.key(), write.payload(), ExpectedVersion.any(), correlationId);
        report.registryCopied();
        log.info("Registry singleton copied to {}", primary.name());
        return checkpointStore.update(checkpoint, c -> c.withRegistryCopied(clock.instant()));
    }

    private void dispatch(
        List<String> slugs,
        LegacyRegistry registry,
        Checkpoint checkpoint,
        MigrationConfig config,
        MigrationReport.Builder report,
        CorrelationId correlationId
    ) {
        AtomicInteger workerIds = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(config.concurrency(), r -> {
            Thread thread = new Thread(r, "cutover-migration-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        Semaphore permits = new Semaphore(config.concurrency());

        try {
            for (String slug : slugs) {
                if (config.resume() && checkpoint.isCompleted(slug)) {
                    log.debug("Organization {} already completed, skipping", slug);
                    report.alreadyDone(slug);
                    continue;
                }
                if (cancelled.get()) {
                    report.notDispatched(slug);
                    continue;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    report.notDispatched(slug);
                    continue;
                }
                if (cancelled.get()) {
                    permits.release();
                    report.notDispatched(slug);
                    continue;
                }
                workers.execute(() -> {
                    try {
                        migrateOrganization(slug, registry, checkpoint, config, report, correlationId);
                    } finally {
                        permits.release();
                    }
                });
            }
        } finally {
            awaitWorkers(workers);
        }
        if (cancelled.get()) {
            report.cancelled();
        }
    }

    private void migrateOrganization(
        String slug,
        LegacyRegistry registry,
        Checkpoint initial,
        MigrationConfig config,
        MigrationReport.Builder report,
        CorrelationId correlationId
    ) {
        RecordKey orgKey = RecordKey.organization(slug);
        try (MDC.MDCCloseable ignoredSlug = MDC.putCloseable(MDC_ORG_SLUG, slug);
             CorrelationScope ignoredScope = CorrelationScope.open(correlationId)) {

            // 1. Legacy 문서 읽기
            Optional<StoredRecord> record = legacy.get(orgKey, correlationId);
            if (record.isEmpty()) {
                log.warn("Organization {} listed in registry but not found in {}", slug, legacy.name());
                report.skipped(slug, "not found in " + legacy.name());
                return;
            }

            // 2. 검증 및 쓰기 목록
            List<PlannedWrite> writes;
            try {
                writes = planner.plan(slug, record.get().payload(), registry.summaryOf(slug), config.normalizer());
            } catch (RecordValidationException e) {
                String reason = e.getViolations().isEmpty()
                    ? e.getMessage()
                    : e.getMessage() + ": " + String.join("; ", e.getViolations());
                log.warn("Organization {} skipped: {}", slug, reason);
                report.skipped(slug, reason);
                return;
            }

            if (config.dryRun()) {
                writes.forEach(w -> log.info("[dry-run] {}", w));
                report.planned(writes);
                return;
            }

            // 3. Primary에 쓰기
            for (PlannedWrite write : writes) {
                primary.put(write.key(), write.payload(), ExpectedVersion.any(), correlationId);
            }

            // 4. 체크포인트 기록
            checkpointStore.update(initial, c -> c.withCompleted(slug, clock.instant()));
            report.migrated(slug);
            log.info("Organization {} migrated ({} records)", slug, writes.size());

        } catch (StoreException | CheckpointException e) {
            log.error("Organization {} failed: {}", slug, e.getMessage(), e);
            report.failed(slug, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Organization {} failed unexpectedly", slug, e);
            report.failed(slug, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void awaitWorkers(ExecutorService workers) {
        workers.shutdown();
        try {
            while (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.info("Waiting for in-flight organizations to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            log.warn("Interrupted while waiting for workers, in-flight organizations may be incomplete");
        }
    }
}
