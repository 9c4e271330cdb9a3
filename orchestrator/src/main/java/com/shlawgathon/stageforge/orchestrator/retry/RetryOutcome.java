package com.shlawgathon.stageforge.orchestrator.retry;

import lombok.Value;

/**
 * Value returned by a successful attempt, with the number of attempts it took.
 */
@Value
public class RetryOutcome<T> {
    T value;
    int attempts;
}
