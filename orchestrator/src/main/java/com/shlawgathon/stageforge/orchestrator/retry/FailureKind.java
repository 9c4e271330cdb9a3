package com.shlawgathon.stageforge.orchestrator.retry;

/**
 * How a single stage failure is handled by the retry boundary.
 */
public enum FailureKind {
    /** Transient; retried while attempts remain. */
    RETRYABLE,
    /** Attempted once; whether the run survives is up to the stage's registration. */
    NON_RETRYABLE,
    /** Stops the run: never retried, never degraded. */
    CRITICAL
}
