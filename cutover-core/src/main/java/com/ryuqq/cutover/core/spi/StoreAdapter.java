package com.ryuqq.cutover.core.spi;

import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Document store SPI over a single physical backend.
 *
 * <p>Each implementation wraps one backend (table store, blob store, local emulator,
 * in-memory map) and exposes uniform get/put/query operations over
 * {@link RecordKey}s. Both the primary and the legacy store are reached through this
 * interface, so the repository layer never depends on a backend client library.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Issue a fresh {@link VersionToken} on every successful put</li>
 *   <li>Reject a put whose {@link ExpectedVersion} does not hold</li>
 *   <li>Assign a per-key monotonic updated-at timestamp</li>
 *   <li>Surface transient backend errors as {@link TransientStoreException}</li>
 * </ul>
 *
 * <p><strong>Not Responsible For:</strong></p>
 * <ul>
 *   <li>Retrying transient errors (see {@code RetryingStoreAdapter})</li>
 *   <li>Interpreting payloads</li>
 *   <li>Deleting records; this subsystem never hard-deletes</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Atomic check-and-set per key: two concurrent puts presenting the same token
 *       must result in exactly one success</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface StoreAdapter {

    /**
     * Reads a record.
     *
     * @param key the record key
     * @param correlationId correlation id for structured logging
     * @return the stored record, or empty when the key is absent
     * @throws IllegalArgumentException if key or correlationId is null
     * @throws TransientStoreException if the backend failed transiently
     * @throws StoreUnavailableException if the backend is unreachable
     */
    Optional<StoredRecord> get(RecordKey key, CorrelationId correlationId);

    /**
     * Writes a record if the expected version holds.
     *
     * <p>{@link ExpectedVersion#any()} is an unconditional create-or-replace and is
     * reserved for the migration engine.</p>
     *
     * @param key the record key
     * @param payload the serialized document
     * @param expected the version condition
     * @param correlationId correlation id for structured logging
     * @return the new version token
     * @throws IllegalArgumentException if any argument is null
     * @throws VersionConflictException if the expected version does not hold
     * @throws TransientStoreException if the backend failed transiently
     * @throws StoreUnavailableException if the backend is unreachable
     */
    VersionToken put(RecordKey key, Payload payload, ExpectedVersion expected, CorrelationId correlationId);

    /**
     * Lists records under a key prefix, ordered by key.
     *
     * <p>The returned stream is lazy and may hold backend resources; callers close it.</p>
     *
     * @param prefix table and partition-key prefix
     * @param correlationId correlation id for structured logging
     * @return stream of matching records (may be empty)
     * @throws IllegalArgumentException if prefix or correlationId is null
     */
    Stream<StoredRecord> query(KeyPrefix prefix, CorrelationId correlationId);

    /**
     * Backend name used in logs and reports.
     *
     * @return backend name
     */
    String name();
}
