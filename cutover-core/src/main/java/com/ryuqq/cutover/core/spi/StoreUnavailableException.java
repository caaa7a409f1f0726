package com.ryuqq.cutover.core.spi;

/**
 * The backend is unreachable or throttled after retries were exhausted.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String backend, String message) {
        super(backend, message);
    }

    public StoreUnavailableException(String backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
