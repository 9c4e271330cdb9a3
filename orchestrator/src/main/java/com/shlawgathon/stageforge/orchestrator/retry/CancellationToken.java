package com.shlawgathon.stageforge.orchestrator.retry;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared between whoever controls a run and the thread
 * executing it.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
