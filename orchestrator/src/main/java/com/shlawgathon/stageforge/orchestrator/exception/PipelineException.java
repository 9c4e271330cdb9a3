package com.shlawgathon.stageforge.orchestrator.exception;

import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the exceptions a stage may raise. Carries the diagnostic context that
 * ends up in the structured {@code PipelineError}, plus the critical flag that
 * {@code FailureClassifier} reads.
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private final ErrorSeverity severity;
    private final boolean critical;
    private final Map<String, Object> context;

    protected PipelineException(String message, Throwable cause, ErrorSeverity severity,
            boolean critical, Map<String, Object> context) {
        super(message, cause);
        this.severity = severity;
        this.critical = critical;
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
