package com.ryuqq.cutover.core.spi;

import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.RecordKey;

/**
 * The expected version of a put did not hold.
 *
 * <p>Never retried by the adapter layer. The caller decides whether to reload and retry.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class VersionConflictException extends StoreException {

    private final RecordKey key;

    public VersionConflictException(String backend, RecordKey key, ExpectedVersion expected) {
        super(backend, "Version conflict on " + key + " (expected: " + expected + ", backend: " + backend + ")");
        this.key = key;
    }

    public RecordKey getKey() {
        return key;
    }
}
