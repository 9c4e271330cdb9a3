package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.Map;

/**
 * Transient condition (network hiccup, lock contention, rate limit). Always
 * eligible for retry.
 */
public class RecoverableError extends PipelineException {

    public RecoverableError(String message) {
        this(message, null, ErrorSeverity.MEDIUM, Map.of());
    }

    public RecoverableError(String message, Throwable cause) {
        this(message, cause, ErrorSeverity.MEDIUM, Map.of());
    }

    public RecoverableError(String message, Throwable cause, ErrorSeverity severity,
            Map<String, Object> context) {
        super(message, cause, severity, false, context);
    }

    protected RecoverableError(String message, Throwable cause, ErrorSeverity severity,
            boolean critical, Map<String, Object> context) {
        super(message, cause, severity, critical, context);
    }
}
