package com.ryuqq.cutover.testkit.store;

import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.spi.StoreAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Test double that records every call and optionally injects failures.
 *
 * <p>Wraps a real adapter so that state behaves normally while tests observe call
 * counts ("the legacy store was never written") and force failures on chosen
 * operations.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingStoreAdapter primary = new RecordingStoreAdapter(new InMemoryStoreAdapter("primary"));
 * primary.failPuts(key -&gt; new StoreUnavailableException("primary", "down"));
 * ...
 * assertThat(legacy.putCount()).isZero();
 * </pre>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class RecordingStoreAdapter implements StoreAdapter {

    private final StoreAdapter delegate;

    private final AtomicInteger getCount = new AtomicInteger();
    private final AtomicInteger putCount = new AtomicInteger();
    private final AtomicInteger queryCount = new AtomicInteger();
    private final List<RecordKey> putKeys = Collections.synchronizedList(new ArrayList<>());
    private final List<ExpectedVersion> putConditions = Collections.synchronizedList(new ArrayList<>());

    private final AtomicReference<Function<RecordKey, RuntimeException>> getFailure = new AtomicReference<>();
    private final AtomicReference<Function<RecordKey, RuntimeException>> putFailure = new AtomicReference<>();
    private final AtomicInteger remainingPutFailures = new AtomicInteger(Integer.MAX_VALUE);
    private final AtomicReference<Function<KeyPrefix, RuntimeException>> queryFailure = new AtomicReference<>();

    public RecordingStoreAdapter(StoreAdapter delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public Optional<StoredRecord> get(RecordKey key, CorrelationId correlationId) {
        getCount.incrementAndGet();
        Function<RecordKey, RuntimeException> failure = getFailure.get();
        if (failure != null) {
            throw failure.apply(key);
        }
        return delegate.get(key, correlationId);
    }

    @Override
    public VersionToken put(RecordKey key, Payload payload, ExpectedVersion expected, CorrelationId correlationId) {
        putCount.incrementAndGet();
        putKeys.add(key);
        putConditions.add(expected);
        Function<RecordKey, RuntimeException> failure = putFailure.get();
        if (failure != null && remainingPutFailures.getAndDecrement() > 0) {
            throw failure.apply(key);
        }
        return delegate.put(key, payload, expected, correlationId);
    }

    @Override
    public Stream<StoredRecord> query(KeyPrefix prefix, CorrelationId correlationId) {
        queryCount.incrementAndGet();
        Function<KeyPrefix, RuntimeException> failure = queryFailure.get();
        if (failure != null) {
            throw failure.apply(prefix);
        }
        return delegate.query(prefix, correlationId);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    /**
     * Makes every subsequent get throw.
     */
    public void failGets(Function<RecordKey, RuntimeException> failure) {
        getFailure.set(failure);
    }

    /**
     * Makes every subsequent put throw.
     */
    public void failPuts(Function<RecordKey, RuntimeException> failure) {
        failPuts(Integer.MAX_VALUE, failure);
    }

    /**
     * Makes the next {@code times} puts throw, then lets puts through again.
     */
    public void failPuts(int times, Function<RecordKey, RuntimeException> failure) {
        remainingPutFailures.set(times);
        putFailure.set(failure);
    }

    /**
     * Makes every subsequent query throw.
     */
    public void failQueries(Function<KeyPrefix, RuntimeException> failure) {
        queryFailure.set(failure);
    }

    /**
     * Removes injected failures.
     */
    public void heal() {
        getFailure.set(null);
        putFailure.set(null);
        queryFailure.set(null);
        remainingPutFailures.set(Integer.MAX_VALUE);
    }

    /**
     * Resets counters without touching stored data.
     */
    public void resetCounts() {
        getCount.set(0);
        putCount.set(0);
        queryCount.set(0);
        putKeys.clear();
        putConditions.clear();
    }

    public int getCount() {
        return getCount.get();
    }

    public int putCount() {
        return putCount.get();
    }

    public int queryCount() {
        return queryCount.get();
    }

    /**
     * Keys of every put attempt, in call order (failed attempts included).
     */
    public List<RecordKey> putKeys() {
        synchronized (putKeys) {
            return List.copyOf(putKeys);
        }
    }

    /**
     * Expected-version conditions of every put attempt, in call order.
     */
    public List<ExpectedVersion> putConditions() {
        synchronized (putConditions) {
            return List.copyOf(putConditions);
        }
    }

    public StoreAdapter getDelegate() {
        return delegate;
    }
}
