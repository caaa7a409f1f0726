package com.ryuqq.cutover.core.spi;

/**
 * Base type of every store failure.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public abstract class StoreException extends RuntimeException {

    private final String backend;

    protected StoreException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    protected StoreException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    /**
     * Name of the backend that raised the failure.
     *
     * @return backend name (null when not tied to a backend)
     */
    public String getBackend() {
        return backend;
    }
}
