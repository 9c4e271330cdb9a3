package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;

import java.util.Map;

/**
 * Checkpoint persistence or resume failure.
 */
public class CheckpointError extends RecoverableError {

    public CheckpointError(String message) {
        this(message, (Throwable) null);
    }

    public CheckpointError(String message, Throwable cause) {
        super(message, cause, ErrorSeverity.HIGH, false, Map.of());
    }

    public CheckpointError(String message, Map<String, Object> context) {
        super(message, null, ErrorSeverity.HIGH, false, context);
    }
}
