package com.ryuqq.cutover.application.coordinator;

import com.ryuqq.cutover.application.document.DocumentCodec;
import com.ryuqq.cutover.application.routing.ReadRoute;
import com.ryuqq.cutover.application.routing.Routes;
import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.application.routing.WriteOrder;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.outcome.Conflict;
import com.ryuqq.cutover.core.outcome.Ok;
import com.ryuqq.cutover.core.outcome.Outcome;
import com.ryuqq.cutover.core.outcome.Unavailable;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.core.spi.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Dual-Write Coordinator.
 *
 * <p>쓰기 경로에 따라 한 저장소 또는 두 저장소에 read-modify-write를 수행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>쓰기 대상마다 현재 레코드와 버전 토큰 로드</li>
 *   <li>읽기 경로가 서비스하는 레코드를 변경 기준(base)으로 선택</li>
 *   <li>base(없으면 빈 문서)에 mutator 적용, 검증, updatedAt 기록</li>
 *   <li>{@link WriteOrder} 순서로 대상에 조건부 쓰기</li>
 * </ol>
 *
 * <p><strong>실패 규칙:</strong></p>
 * <ul>
 *   <li>첫 번째 쓰기 실패: 전체 실패, 두 번째 대상은 호출하지 않음</li>
 *   <li>첫 번째 쓰기 충돌: 한 번만 재로드 후 재시도, 다시 충돌하면 {@link Conflict}</li>
 *   <li>호출자가 버전을 고정한 쓰기: 재시도 없음, 오래된 토큰은 즉시 {@link Conflict}</li>
 *   <li>두 번째 쓰기 실패: {@link Ok#partial()} 및 PartialWriteFailure WARN 로그</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class DualWriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DualWriteCoordinator.class);

    private static final int MAX_ATTEMPTS = 2;

    private final StoreAdapter primary;
    private final StoreAdapter legacy;
    private final WriteOrder writeOrder;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param primary Primary 저장소
     * @param legacy Legacy 저장소
     * @param writeOrder 이중 쓰기 순서
     * @param clock updatedAt 시각
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DualWriteCoordinator(StoreAdapter primary, StoreAdapter legacy, WriteOrder writeOrder, Clock clock) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (writeOrder == null) {
            throw new IllegalArgumentException("writeOrder cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.primary = primary;
        this.legacy = legacy;
        this.writeOrder = writeOrder;
        this.clock = clock;
    }

    /**
     * read-modify-write (충돌 시 한 번 재시도).
     *
     * @param routes 호출 시점의 경로
     * @param key 레코드 키
     * @param codec 문서 코덱
     * @param mutator 문서 변경 함수 (null 반환 불가)
     * @param correlationId 상관관계 ID
     * @return Ok | Conflict | Unavailable
     * @throws com.ryuqq.cutover.core.spi.RecordValidationException 저장된 문서나 변경 결과가 유효하지 않은 경우
     */
    public <T> Outcome<T> write(
        Routes routes,
        RecordKey key,
        DocumentCodec<T> codec,
        UnaryOperator<T> mutator,
        CorrelationId correlationId
    ) {
        return execute(routes, key, codec, null, mutator, correlationId);
    }

    /**
     * 호출자가 읽은 버전을 고정한 read-modify-write (재시도 없음).
     *
     * @param pinned 호출자가 마지막으로 읽은 토큰
     * @see #write(Routes, RecordKey, DocumentCodec, UnaryOperator, CorrelationId)
     */
    public <T> Outcome<T> writePinned(
        Routes routes,
        RecordKey key,
        DocumentCodec<T> codec,
        VersionToken pinned,
        UnaryOperator<T> mutator,
        CorrelationId correlationId
    ) {
        if (pinned == null) {
            throw new IllegalArgumentException("pinned cannot be null");
        }
        return execute(routes, key, codec, pinned, mutator, correlationId);
    }

    private <T> Outcome<T> execute(
        Routes routes,
        RecordKey key,
        DocumentCodec<T> codec,
        VersionToken pinned,
        UnaryOperator<T> mutator,
        CorrelationId correlationId
    ) {
        if (routes == null) {
            throw new IllegalArgumentException("routes cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }

        List<StoreRole> targets = routes.write().targets(writeOrder);
        int maxAttempts = pinned == null ? MAX_ATTEMPTS : 1;

        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            for (int attempt = 1; ; attempt++) {
                try {
                    return attempt(routes, targets, key, codec, pinned, mutator, correlationId);
                } catch (VersionConflictException e) {
                    if (attempt >= maxAttempts) {
                        log.info("Write conflict on {} after {} attempt(s)", key, attempt);
                        return new Conflict<>(key, "version changed concurrently on " + e.getBackend());
                    }
                    log.debug("Write conflict on {}, reloading (attempt {}/{})", key, attempt, maxAttempts);
                } catch (StoreUnavailableException e) {
                    log.warn("Write to {} failed, backend {} unavailable: {}", key, e.getBackend(), e.getMessage());
                    return new Unavailable<>(key, e.getBackend(), e.getMessage());
                }
            }
        }
    }

    private <T> Outcome<T> attempt(
        Routes routes,
        List<StoreRole> targets,
        RecordKey key,
        DocumentCodec<T> codec,
        VersionToken pinned,
        UnaryOperator<T> mutator,
        CorrelationId correlationId
    ) {
        StoreRole first = targets.get(0);

        // 1. 대상별 현재 상태 로드 (첫 번째 대상 실패는 전체 실패)
        Map<StoreRole, Loaded> loaded = new EnumMap<>(StoreRole.class);
        for (StoreRole role : targets) {
            try {
                loaded.put(role, Loaded.of(adapter(role).get(key, correlationId)));
            } catch (StoreUnavailableException e) {
                if (role == first) {
                    throw e;
                }
                loaded.put(role, Loaded.failed(e));
            }
        }

        // 2. 변경 기준 선택
        StoredRecord base = resolveBase(routes, key, loaded, correlationId);

        // 3. 고정 버전 확인
        if (pinned != null) {
            VersionToken current = base == null ? null : base.version();
            if (!pinned.equals(current)) {
                log.info("Stale pinned version on {}: expected={}, current={}", key, pinned, current);
                return new Conflict<>(key, "expected version " + pinned.getValue() + " but current is "
                    + (current == null ? "absent" : current.getValue()));
            }
        }

        // 4. 변경 적용
        T document = base == null ? codec.blank(key) : codec.decode(key, base.payload());
        T mutated = mutator.apply(document);
        if (mutated == null) {
            throw new IllegalStateException("mutator returned null for " + key);
        }
        codec.verify(key, mutated);
        T stamped = codec.stamp(mutated, clock.instant());
        Payload payload = codec.encode(stamped);

        // 5. 첫 번째 대상 쓰기
        VersionToken firstToken = adapter(first).put(
            key, payload, ExpectedVersion.of(loaded.get(first).token()), correlationId);
        if (targets.size() == 1) {
            return Ok.of(stamped, firstToken);
        }

        // 6. 두 번째 대상 쓰기 (실패는 부분 성공)
        StoreRole second = targets.get(1);
        Loaded secondState = loaded.get(second);
        if (secondState.failure() != null) {
            logPartialWrite(key, second, secondState.failure());
            return Ok.partial(stamped, firstToken);
        }
        try {
            VersionToken secondToken = adapter(second).put(
                key, payload, ExpectedVersion.of(secondState.token()), correlationId);
            VersionToken served = routes.servingRole() == second ? secondToken : firstToken;
            return Ok.of(stamped, served);
        } catch (VersionConflictException | StoreUnavailableException e) {
            logPartialWrite(key, second, e);
            return Ok.partial(stamped, firstToken);
        }
    }

    /**
     * 읽기 경로가 이 키에 대해 돌려줄 레코드.
     */
    private StoredRecord resolveBase(
        Routes routes,
        RecordKey key,
        Map<StoreRole, Loaded> loaded,
        CorrelationId correlationId
    ) {
        if (routes.read() == ReadRoute.LEGACY_ONLY) {
            return require(loaded, StoreRole.LEGACY, key, correlationId).orElse(null);
        }
        Loaded primaryState = loaded.get(StoreRole.PRIMARY);
        if (primaryState != null && primaryState.failure() == null && primaryState.record() != null) {
            return primaryState.record();
        }
        return require(loaded, StoreRole.LEGACY, key, correlationId).orElse(null);
    }

    private Optional<StoredRecord> require(
        Map<StoreRole, Loaded> loaded,
        StoreRole role,
        RecordKey key,
        CorrelationId correlationId
    ) {
        Loaded state = loaded.get(role);
        if (state == null) {
            return adapter(role).get(key, correlationId);
        }
        if (state.failure() != null) {
            throw state.failure();
        }
        return Optional.ofNullable(state.record());
    }

    private void logPartialWrite(RecordKey key, StoreRole role, RuntimeException error) {
        log.warn("PartialWriteFailure table={} key={} backend={} error={}: {}",
            key.table().tableName(), key, adapter(role).name(), error.getClass().getSimpleName(), error.getMessage());
    }

    private StoreAdapter adapter(StoreRole role) {
        return role == StoreRole.PRIMARY ? primary : legacy;
    }

    /**
     * 한 대상의 로드 결과 (레코드 또는 실패).
     */
    private record Loaded(StoredRecord record, StoreUnavailableException failure) {

        static Loaded of(Optional<StoredRecord> record) {
            return new Loaded(record.orElse(null), null);
        }

        static Loaded failed(StoreUnavailableException failure) {
            return new Loaded(null, failure);
        }

        VersionToken token() {
            return record == null ? null : record.version();
        }
    }
}
