package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.List;
import java.util.Map;

/**
 * Validation failure. Retry-eligible unless created through {@link #critical}.
 */
public class ValidationError extends RecoverableError {

    public ValidationError(String message) {
        this(message, null, Map.of());
    }

    public ValidationError(String message, Map<String, Object> context) {
        this(message, null, context);
    }

    public ValidationError(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorSeverity.HIGH, false, context);
    }

    private ValidationError(String message, Throwable cause, Map<String, Object> context, boolean critical) {
        super(message, cause, critical ? ErrorSeverity.CRITICAL : ErrorSeverity.HIGH, critical, context);
    }

    /**
     * Violations reported by the validator, if it attached any under {@code "violations"}.
     */
    @SuppressWarnings("unchecked")
    public List<String> getViolations() {
        Object violations = getContext().get("violations");
        return violations instanceof List<?> list ? (List<String>) list : List.of();
    }

    /**
     * A validation failure that must stop the run instead of being retried.
     */
    public static ValidationError critical(String message, Map<String, Object> context) {
        return new ValidationError(message, null, context, true);
    }
}
