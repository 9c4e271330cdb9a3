package com.shlawgathon.stageforge.orchestrator.retry;

import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code k} (zero-based) is followed by a
 * wait of {@code initialDelay * backoffMultiplier^k}.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    double backoffMultiplier = 2.0;

    // Granularity of the cancellation check while waiting
    @Builder.Default
    Duration pollInterval = Duration.ofMillis(100);

    public static RetryPolicy singleAttempt() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * Policy for a run: the configured backoff when retry is enabled, one attempt otherwise.
     */
    public static RetryPolicy from(PipelineConfig config, Duration pollInterval) {
        if (!config.isEnableRetry()) {
            return singleAttempt().toBuilder().pollInterval(pollInterval).build();
        }
        return RetryPolicy.builder()
                .maxAttempts(Math.max(1, config.getMaxRetryAttempts()))
                .initialDelay(config.getInitialRetryDelay())
                .backoffMultiplier(config.getBackoffMultiplier())
                .pollInterval(pollInterval)
                .build();
    }

    /**
     * Wait that follows the failed attempt with zero-based index {@code attempt}.
     */
    public Duration delayAfter(int attempt) {
        double nanos = initialDelay.toNanos() * Math.pow(backoffMultiplier, attempt);
        return Duration.ofNanos(Math.round(nanos));
    }
}
