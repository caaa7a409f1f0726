package com.ryuqq.cutover.core.spi;

import java.util.List;

/**
 * A document does not have the expected shape, or a write would break a
 * cross-record invariant (for example a date entry pointing at a missing hunt).
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class RecordValidationException extends StoreException {

    private final List<String> violations;

    public RecordValidationException(String message) {
        this(message, List.of());
    }

    public RecordValidationException(String message, List<String> violations) {
        super(null, violations.isEmpty() ? message : message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
