package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;
import lombok.Getter;

import java.util.Map;

/**
 * Raised when a run is cancelled while an operation waits for its next attempt.
 * Treated as critical: a cancelled stage is neither retried nor degraded.
 */
@Getter
public class RetryCancelledException extends PipelineException {

    private final int attempts;

    public RetryCancelledException(String operation, int attempts, Throwable lastFailure) {
        super("Operation '" + operation + "' cancelled after " + attempts + " attempts",
                lastFailure, ErrorSeverity.HIGH, true, Map.of("attempts", attempts));
        this.attempts = attempts;
    }
}
