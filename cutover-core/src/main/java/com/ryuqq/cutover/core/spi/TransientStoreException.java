package com.ryuqq.cutover.core.spi;

/**
 * A backend call failed in a way that may succeed when repeated (timeout, throttling, I/O).
 *
 * <p>Raised by concrete adapters and consumed by {@code RetryingStoreAdapter}; it never
 * reaches repository callers.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String backend, String message) {
        super(backend, message);
    }

    public TransientStoreException(String backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
