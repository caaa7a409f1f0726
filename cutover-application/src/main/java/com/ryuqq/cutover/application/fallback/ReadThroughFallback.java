package com.ryuqq.cutover.application.fallback;

import com.ryuqq.cutover.application.routing.ReadRoute;
import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.core.spi.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-Through Fallback.
 *
 * <p><strong>읽기 규칙 (PRIMARY_WITH_FALLBACK):</strong></p>
 * <ol>
 *   <li>Primary 조회, 있으면 반환</li>
 *   <li>NotFound 또는 Unavailable이면 Legacy 조회</li>
 *   <li>Primary가 NotFound였고 Legacy에 있으면 backfill 예약</li>
 * </ol>
 *
 * <p><strong>Backfill:</strong></p>
 * <ul>
 *   <li>주입된 {@link Executor}에서 실행되며 읽기 응답을 기다리게 하지 않음</li>
 *   <li>{@link ExpectedVersion#absent()} 조건이므로 그 사이 생성된 Primary 레코드를 덮어쓰지 않음</li>
 *   <li>장애 시 한 번만 재시도, 실패와 충돌은 로그만 남김</li>
 * </ul>
 *
 * <p>Primary가 Unavailable이었던 경우에는 backfill하지 않습니다.
 * 접두사 조회는 두 저장소를 모두 읽어 병합합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class ReadThroughFallback {

    private static final Logger log = LoggerFactory.getLogger(ReadThroughFallback.class);

    private final StoreAdapter primary;
    private final StoreAdapter legacy;
    private final Executor backfillExecutor;

    public ReadThroughFallback(StoreAdapter primary, StoreAdapter legacy, Executor backfillExecutor) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (backfillExecutor == null) {
            throw new IllegalArgumentException("backfillExecutor cannot be null");
        }
        this.primary = primary;
        this.legacy = legacy;
        this.backfillExecutor = backfillExecutor;
    }

    /**
     * 단일 키 읽기.
     *
     * @param route 읽기 경로
     * @param key 레코드 키
     * @param correlationId 상관관계 ID
     * @return 레코드와 서비스 저장소 (어디에도 없으면 empty)
     * @throws StoreUnavailableException 읽어야 할 저장소가 모두 응답하지 않는 경우
     */
    public Optional<ServedRecord> read(ReadRoute route, RecordKey key, CorrelationId correlationId) {
        if (route == null) {
            throw new IllegalArgumentException("route cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            if (route == ReadRoute.LEGACY_ONLY) {
                return legacy.get(key, correlationId).map(r -> new ServedRecord(r, StoreRole.LEGACY));
            }

            StoreUnavailableException primaryFailure = null;
            try {
                Optional<StoredRecord> fromPrimary = primary.get(key, correlationId);
                if (fromPrimary.isPresent()) {
                    return Optional.of(new ServedRecord(fromPrimary.get(), StoreRole.PRIMARY));
                }
            } catch (StoreUnavailableException e) {
                log.warn("Primary {} unavailable for {}, reading legacy: {}", e.getBackend(), key, e.getMessage());
                primaryFailure = e;
            }

            Optional<StoredRecord> fromLegacy = readLegacy(() -> legacy.get(key, correlationId), primaryFailure);
            if (fromLegacy.isPresent() && primaryFailure == null) {
                scheduleBackfill(fromLegacy.get(), correlationId);
            }
            return fromLegacy.map(r -> new ServedRecord(r, StoreRole.LEGACY));
        }
    }

    /**
     * 접두사 조회.
     *
     * <p>Primary와 Legacy 결과를 키 단위로 병합하며 같은 키는 Primary가 우선합니다.
     * Primary에 없는 키만 backfill을 예약합니다.</p>
     *
     * <p>한쪽만 응답하지 않으면 응답한 쪽의 결과를 반환하고 WARN 로그를 남깁니다.</p>
     *
     * @param route 읽기 경로
     * @param prefix 키 접두사
     * @param correlationId 상관관계 ID
     * @return 키 순서로 정렬된 레코드 목록
     * @throws StoreUnavailableException 읽어야 할 저장소가 모두 응답하지 않는 경우
     */
    public List<ServedRecord> queryPartition(ReadRoute route, KeyPrefix prefix, CorrelationId correlationId) {
        if (route == null) {
            throw new IllegalArgumentException("route cannot be null");
        }
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            if (route == ReadRoute.LEGACY_ONLY) {
                return served(collect(legacy, prefix, correlationId), StoreRole.LEGACY);
            }

            // 1. Primary 조회
            List<StoredRecord> fromPrimary = List.of();
            StoreUnavailableException primaryFailure = null;
            try {
                fromPrimary = collect(primary, prefix, correlationId);
            } catch (StoreUnavailableException e) {
                log.warn("Primary {} unavailable for {}, querying legacy: {}", e.getBackend(), prefix, e.getMessage());
                primaryFailure = e;
            }

            // 2. Legacy 조회 (Primary가 응답했다면 Legacy 장애는 로그만 남김)
            List<StoredRecord> fromLegacy;
            if (primaryFailure != null) {
                fromLegacy = readLegacy(() -> collect(legacy, prefix, correlationId), primaryFailure);
            } else {
                try {
                    fromLegacy = collect(legacy, prefix, correlationId);
                } catch (StoreUnavailableException e) {
                    log.warn("Legacy {} unavailable for {}, returning {} primary rows only: {}",
                        e.getBackend(), prefix, fromPrimary.size(), e.getMessage());
                    return served(fromPrimary, StoreRole.PRIMARY);
                }
            }

            // 3. 키 단위 병합, Primary 우선
            Map<RecordKey, ServedRecord> merged = new TreeMap<>();
            fromLegacy.forEach(r -> merged.put(r.key(), new ServedRecord(r, StoreRole.LEGACY)));
            fromPrimary.forEach(r -> merged.put(r.key(), new ServedRecord(r, StoreRole.PRIMARY)));

            // 4. Primary에 없는 키만 backfill
            if (primaryFailure == null) {
                merged.values().stream()
                    .filter(r -> r.servedBy() == StoreRole.LEGACY)
                    .forEach(r -> scheduleBackfill(r.record(), correlationId));
            }
            return new ArrayList<>(merged.values());
        }
    }

    private <R> R readLegacy(Supplier<R> read, StoreUnavailableException primaryFailure) {
        try {
            return read.get();
        } catch (StoreUnavailableException e) {
            if (primaryFailure != null) {
                e.addSuppressed(primaryFailure);
            }
            throw e;
        }
    }

    private static List<StoredRecord> collect(StoreAdapter adapter, KeyPrefix prefix, CorrelationId correlationId) {
        try (Stream<StoredRecord> records = adapter.query(prefix, correlationId)) {
            return records.collect(Collectors.toList());
        }
    }

    private static List<ServedRecord> served(List<StoredRecord> records, StoreRole role) {
        return records.stream().map(r -> new ServedRecord(r, role)).collect(Collectors.toList());
    }

    private void scheduleBackfill(StoredRecord record, CorrelationId correlationId) {
        try {
            backfillExecutor.execute(() -> backfill(record, correlationId));
        } catch (RejectedExecutionException e) {
            log.warn("Backfill of {} rejected by executor: {}", record.key(), e.getMessage());
        }
    }

    /**
     * Legacy 레코드를 Primary에 create-if-absent로 복사.
     */
    void backfill(StoredRecord record, CorrelationId correlationId) {
        RecordKey key = record.key();
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            for (int attempt = 1; attempt <= 2; attempt++) {
                try {
                    primary.put(key, record.payload(), ExpectedVersion.absent(), correlationId);
                    log.info("Backfilled {} into {}", key, primary.name());
                    return;
                } catch (VersionConflictException e) {
                    log.debug("Backfill of {} skipped, already present in {}", key, primary.name());
                    return;
                } catch (StoreUnavailableException e) {
                    if (attempt == 2) {
                        log.warn("Backfill of {} into {} failed: {}", key, primary.name(), e.getMessage());
                    } else {
                        log.debug("Backfill of {} hit unavailable backend, retrying once", key);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.warn("Backfill of {} into {} failed", key, primary.name(), e);
        }
    }
}
