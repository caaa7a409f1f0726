package com.ryuqq.cutover.core.protection;

import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.core.spi.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Transient 오류를 재시도하는 StoreAdapter 데코레이터.
 *
 * <p>위임 어댑터가 {@link TransientStoreException}을 던지면 {@link RetryPolicy}에 따라
 * 지수 백오프로 재시도하고, 소진되면 {@link StoreUnavailableException}으로 변환합니다.
 * 그 외 예외(버전 충돌 포함)는 재시도 없이 그대로 전파됩니다.</p>
 *
 * <p><strong>재시도 흐름:</strong></p>
 * <pre>
 * attempt 0 → TransientStoreException → sleep(backoff(1)) →
 * attempt 1 → TransientStoreException → sleep(backoff(2)) → ...
 * attempt maxRetries → TransientStoreException → StoreUnavailableException
 * </pre>
 *
 * <p>query는 스트림을 여는 호출만 재시도합니다. 순회 도중 발생한 transient 오류는
 * 위치를 잃기 때문에 재시도하지 않고 곧바로 StoreUnavailableException으로 변환합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class RetryingStoreAdapter implements StoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(RetryingStoreAdapter.class);

    private final StoreAdapter delegate;
    private final RetryPolicy policy;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 기본 대기 구현으로 생성.
     *
     * @param delegate 위임 어댑터
     * @param policy 재시도 정책
     */
    public RetryingStoreAdapter(StoreAdapter delegate, RetryPolicy policy) {
        this(delegate, policy, Sleeper.threadSleep());
    }

    /**
     * 생성자.
     *
     * @param delegate 위임 어댑터
     * @param policy 재시도 정책
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryingStoreAdapter(StoreAdapter delegate, RetryPolicy policy, Sleeper sleeper) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.delegate = delegate;
        this.policy = policy;
        this.backoffCalculator = policy.toBackoffCalculator();
        this.sleeper = sleeper;
    }

    @Override
    public Optional<StoredRecord> get(RecordKey key, CorrelationId correlationId) {
        return withRetry("get", key, correlationId, () -> delegate.get(key, correlationId));
    }

    @Override
    public VersionToken put(RecordKey key, Payload payload, ExpectedVersion expected, CorrelationId correlationId) {
        return withRetry("put", key, correlationId, () -> delegate.put(key, payload, expected, correlationId));
    }

    @Override
    public Stream<StoredRecord> query(KeyPrefix prefix, CorrelationId correlationId) {
        Stream<StoredRecord> opened = withRetry("query", prefix, correlationId,
            () -> delegate.query(prefix, correlationId));

        Iterator<StoredRecord> source = opened.iterator();
        Iterator<StoredRecord> guarded = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return source.hasNext();
                } catch (TransientStoreException e) {
                    throw unavailable("query", prefix, e);
                }
            }

            @Override
            public StoredRecord next() {
                try {
                    return source.next();
                } catch (TransientStoreException e) {
                    throw unavailable("query", prefix, e);
                }
            }
        };
        return StreamSupport
            .stream(Spliterators.spliteratorUnknownSize(guarded, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(opened::close);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private <T> T withRetry(String operation, Object target, CorrelationId correlationId, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (TransientStoreException e) {
                attempt++;
                if (attempt > policy.maxRetries()) {
                    try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
                        log.warn("Retries exhausted: backend={}, operation={}, target={}, attempts={}",
                            delegate.name(), operation, target, attempt, e);
                    }
                    throw unavailable(operation, target, e);
                }
                long delay = backoffCalculator.calculate(attempt);
                try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
                    log.debug("Transient failure, retrying: backend={}, operation={}, target={}, retry={}, delayMs={}",
                        delegate.name(), operation, target, attempt, delay);
                }
                pause(operation, target, delay);
            }
        }
    }

    private void pause(String operation, Object target, long delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(delegate.name(),
                "Interrupted while backing off " + operation + " on " + target, e);
        }
    }

    private StoreUnavailableException unavailable(String operation, Object target, TransientStoreException cause) {
        return new StoreUnavailableException(delegate.name(),
            operation + " on " + target + " failed after retries: " + cause.getMessage(), cause);
    }
}
