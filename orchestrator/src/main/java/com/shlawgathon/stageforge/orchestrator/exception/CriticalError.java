package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.Map;

/**
 * The whole run must stop. Never retried and never masked by a fallback,
 * whatever the registration of the stage that raised it.
 */
public class CriticalError extends PipelineException {

    public CriticalError(String message) {
        this(message, null, Map.of());
    }

    public CriticalError(String message, Map<String, Object> context) {
        this(message, null, context);
    }

    public CriticalError(String message, Throwable cause, Map<String, Object> context) {
        super(message, cause, ErrorSeverity.CRITICAL, true, context);
    }
}
