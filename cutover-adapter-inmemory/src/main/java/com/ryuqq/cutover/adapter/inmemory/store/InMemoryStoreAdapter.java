package com.ryuqq.cutover.adapter.inmemory.store;

import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of {@link StoreAdapter} SPI for testing and reference purposes.
 *
 * <p>Models a partition/row table store. Records live in a {@link ConcurrentHashMap}
 * keyed by {@link RecordKey}; the version check and the write happen inside a single
 * {@link ConcurrentHashMap#compute} call, which makes check-and-set atomic per key.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;RecordKey, StoredRecord&gt; - current version of each key (O(1) access)</li>
 *   <li><strong>sequence:</strong> AtomicLong - source of opaque version tokens</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get:</strong> O(1)</li>
 *   <li><strong>put:</strong> O(1) - compute on a single bin</li>
 *   <li><strong>query:</strong> O(N log N) - full scan, filtered and sorted by key</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StoreAdapter primary = new InMemoryStoreAdapter("primary");
 * VersionToken v1 = primary.put(key, payload, ExpectedVersion.absent(), cid);
 * primary.put(key, changed, ExpectedVersion.matching(v1), cid);
 * </pre>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class InMemoryStoreAdapter implements StoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStoreAdapter.class);

    private final String name;
    private final Clock clock;
    private final ConcurrentHashMap<RecordKey, StoredRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates an adapter on the system clock.
     *
     * @param name backend name used in logs
     */
    public InMemoryStoreAdapter(String name) {
        this(name, Clock.systemUTC());
    }

    /**
     * Creates an adapter with an explicit clock.
     *
     * @param name backend name used in logs
     * @param clock source of updated-at timestamps
     * @throws IllegalArgumentException if name is blank or clock is null
     */
    public InMemoryStoreAdapter(String name, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.clock = clock;
    }

    @Override
    public Optional<StoredRecord> get(RecordKey key, CorrelationId correlationId) {
        requireArgs(key, correlationId);
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public VersionToken put(RecordKey key, Payload payload, ExpectedVersion expected, CorrelationId correlationId) {
        requireArgs(key, correlationId);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }

        StoredRecord written = records.compute(key, (k, current) -> {
            VersionToken currentToken = current == null ? null : current.version();
            if (!expected.isSatisfiedBy(currentToken)) {
                throw new VersionConflictException(name, key, expected);
            }
            Instant now = clock.instant();
            if (current != null && !now.isAfter(current.updatedAt())) {
                now = current.updatedAt().plusMillis(1);
            }
            return new StoredRecord(k, payload, nextToken(), now);
        });

        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            log.debug("Put {}: backend={}, version={}", key, name, written.version().getValue());
        }
        return written.version();
    }

    @Override
    public Stream<StoredRecord> query(KeyPrefix prefix, CorrelationId correlationId) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        return records.values().stream()
            .filter(record -> prefix.matches(record.key()))
            .sorted((a, b) -> a.key().compareTo(b.key()));
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Current payload of every key, ordered by key.
     *
     * <p>Used by tests comparing store contents while ignoring tokens and timestamps.</p>
     *
     * @return key to payload snapshot
     */
    public Map<RecordKey, Payload> snapshot() {
        return records.values().stream()
            .collect(Collectors.toMap(StoredRecord::key, StoredRecord::payload, (a, b) -> a, TreeMap::new));
    }

    public int size() {
        return records.size();
    }

    /**
     * Clears all records.
     */
    public void clear() {
        records.clear();
    }

    private VersionToken nextToken() {
        return VersionToken.of(name + "-" + Long.toHexString(sequence.incrementAndGet()));
    }

    private void requireArgs(RecordKey key, CorrelationId correlationId) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
    }
}
