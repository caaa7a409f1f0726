package com.ryuqq.cutover.core.spi;

import com.ryuqq.cutover.core.model.CorrelationId;
import org.slf4j.MDC;

/**
 * Places a correlation id into the slf4j MDC for the duration of a backend call.
 *
 * <pre>
 * try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
 *     // log lines here carry %X{correlation_id}
 * }
 * </pre>
 *
 * <p>The previous MDC value is restored on close, so scopes nest.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class CorrelationScope implements AutoCloseable {

    public static final String MDC_KEY = "correlation_id";

    private final String previous;

    private CorrelationScope(String previous) {
        this.previous = previous;
    }

    /**
     * Opens a scope.
     *
     * @param correlationId the id to expose to log lines
     * @return scope to close when the call completes
     * @throws IllegalArgumentException if correlationId is null
     */
    public static CorrelationScope open(CorrelationId correlationId) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, correlationId.getValue());
        return new CorrelationScope(previous);
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, previous);
        }
    }
}
