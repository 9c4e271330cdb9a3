package com.shlawgathon.stageforge.orchestrator.retry;

import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.exception.GenerationError;
import com.shlawgathon.stageforge.orchestrator.exception.PipelineException;
import com.shlawgathon.stageforge.orchestrator.exception.RecoverableError;
import com.shlawgathon.stageforge.orchestrator.exception.TransformationError;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Maps a thrown exception to a {@link FailureKind} by type membership alone.
 * Exception messages are never inspected.
 */
public class FailureClassifier {

    private static final List<Class<? extends Throwable>> DEFAULT_RETRYABLE = List.of(
            RecoverableError.class,
            ValidationError.class,
            TransformationError.class,
            GenerationError.class,
            CheckpointError.class,
            IOException.class,
            UncheckedIOException.class,
            TimeoutException.class);

    private final List<Class<? extends Throwable>> retryable;

    public FailureClassifier() {
        this(DEFAULT_RETRYABLE);
    }

    public FailureClassifier(List<Class<? extends Throwable>> retryable) {
        this.retryable = List.copyOf(retryable);
    }

    public FailureKind classify(Throwable failure) {
        if (failure instanceof PipelineException pe && pe.isCritical()) {
            return FailureKind.CRITICAL;
        }
        for (Class<? extends Throwable> type : retryable) {
            if (type.isInstance(failure)) {
                return FailureKind.RETRYABLE;
            }
        }
        return FailureKind.NON_RETRYABLE;
    }

    public List<Class<? extends Throwable>> getRetryableTypes() {
        return retryable;
    }
}
