package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.Map;

/**
 * Transformation failure. Retry-eligible unless created through {@link #critical}.
 */
public class TransformationError extends RecoverableError {

    public TransformationError(String message) {
        this(message, null, Map.of());
    }

    public TransformationError(String message, Map<String, Object> context) {
        this(message, null, context);
    }

    public TransformationError(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorSeverity.HIGH, false, context);
    }

    private TransformationError(String message, Throwable cause, Map<String, Object> context, boolean critical) {
        super(message, cause, critical ? ErrorSeverity.CRITICAL : ErrorSeverity.HIGH, critical, context);
    }

    /**
     * A transformation failure that must stop the run instead of being retried.
     */
    public static TransformationError critical(String message, Map<String, Object> context) {
        return new TransformationError(message, null, context, true);
    }
}
