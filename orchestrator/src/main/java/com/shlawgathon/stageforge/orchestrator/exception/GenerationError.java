package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.Map;

/**
 * Failure while emitting the final artifact. Retry-eligible unless created
 * through {@link #critical}; the generating stage is hard-critical anyway.
 */
public class GenerationError extends RecoverableError {

    public GenerationError(String message) {
        this(message, null, Map.of());
    }

    public GenerationError(String message, Map<String, Object> context) {
        this(message, null, context);
    }

    public GenerationError(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorSeverity.HIGH, false, context);
    }

    private GenerationError(String message, Throwable cause, Map<String, Object> context, boolean critical) {
        super(message, cause, critical ? ErrorSeverity.CRITICAL : ErrorSeverity.HIGH, critical, context);
    }

    /**
     * A generation failure that must stop the run instead of being retried.
     */
    public static GenerationError critical(String message, Map<String, Object> context) {
        return new GenerationError(message, null, context, true);
    }
}
