package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;
import lombok.Getter;

import java.util.Map;

/**
 * The last failure of an operation that used up every attempt. The original
 * exception is the cause.
 */
@Getter
public class RetryExhaustedException extends PipelineException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Operation '" + operation + "' failed after " + attempts + " attempts: "
                        + lastFailure.getMessage(),
                lastFailure,
                lastFailure instanceof PipelineException pe ? pe.getSeverity() : ErrorSeverity.HIGH,
                false,
                Map.of("attempts", attempts));
        this.operation = operation;
        this.attempts = attempts;
    }
}
