package com.shlawgathon.stageforge.orchestrator.retry;

import java.time.Duration;

/**
 * Blocking wait used between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
