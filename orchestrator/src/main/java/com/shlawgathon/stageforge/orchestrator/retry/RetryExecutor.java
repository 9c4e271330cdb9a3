package com.shlawgathon.stageforge.orchestrator.retry;

import com.shlawgathon.stageforge.orchestrator.exception.RetryCancelledException;
import com.shlawgathon.stageforge.orchestrator.exception.RetryExhaustedException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps one operation in a Resilience4j {@link Retry} with bounded attempts
 * and exponential backoff.
 * <p>
 * Retries are synchronous: the calling thread blocks for the backoff, which is
 * waited out in {@link RetryPolicy#getPollInterval()} slices so that a
 * cancelled {@link CancellationToken} or a thread interrupt ends the wait
 * within one slice. The wait runs inside the retry's interval function, which
 * then hands Resilience4j a zero interval.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final CancellationToken cancellationToken;

    public RetryExecutor(RetryPolicy policy, FailureClassifier classifier,
            Sleeper sleeper, CancellationToken cancellationToken) {
        if (policy.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + policy.getMaxAttempts());
        }
        if (policy.getPollInterval().isNegative() || policy.getPollInterval().isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + policy.getPollInterval());
        }
        this.policy = policy;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Run {@code operation} until it succeeds, fails with a non-retryable
     * exception, or runs out of attempts.
     *
     * @throws RetryExhaustedException wrapping the last failure once every attempt is used
     * @throws RetryCancelledException if cancelled while waiting for the next attempt
     * @throws Exception the operation's own exception when it is not retryable
     */
    public <T> RetryOutcome<T> run(String operation, Callable<T> callable) throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = retryFor(operation, attempts);

        Callable<T> counted = () -> {
            attempts.incrementAndGet();
            return callable.call();
        };

        try {
            T value = Retry.decorateCallable(retry, counted).call();
            return new RetryOutcome<>(value, attempts.get());
        } catch (RetryCancelledException e) {
            throw e;
        } catch (Exception e) {
            // Resilience4j rethrows a retryable failure only once every attempt is used
            switch (classifier.classify(e)) {
                case RETRYABLE:
                    throw new RetryExhaustedException(operation, attempts.get(), e);
                case NON_RETRYABLE:
                case CRITICAL:
                default:
                    throw e;
            }
        }
    }

    /**
     * Convenience form of {@link #run} that drops the attempt count.
     */
    public <T> T execute(String operation, Callable<T> callable) throws Exception {
        return run(operation, callable).getValue();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private Retry retryFor(String operation, AtomicInteger attempts) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .retryOnException(e -> classifier.classify(e) == FailureKind.RETRYABLE)
                .intervalBiFunction((attempt, outcome) -> {
                    Duration delay = policy.delayAfter(attempt - 1);
                    log.warn("[RETRY] {} attempt {}/{} failed. Retrying in {} ms",
                            operation, attempt, policy.getMaxAttempts(), delay.toMillis());
                    await(operation, delay, attempt, outcome.isLeft() ? outcome.getLeft() : null);
                    return 0L;
                })
                .build();

        Retry retry = Retry.of(operation, config);
        retry.getEventPublisher()
                .onSuccess(event -> log.info("[RETRY] {} recovered on attempt {}/{}",
                        operation, attempts.get(), policy.getMaxAttempts()))
                .onError(event -> log.error("[RETRY] {} failed, all {} attempts used: {}",
                        operation, attempts.get(), messageOf(event.getLastThrowable())))
                .onIgnoredError(event -> log.error("[RETRY] {} failed with non-retryable {} ({}): {}",
                        operation, event.getLastThrowable().getClass().getSimpleName(),
                        classifier.classify(event.getLastThrowable()), messageOf(event.getLastThrowable())));
        return retry;
    }

    private void await(String operation, Duration delay, int attempt, Throwable lastFailure) {
        Duration remaining = delay;
        while (!remaining.isNegative() && !remaining.isZero()) {
            if (cancellationToken.isCancelled()) {
                throw cancelled(operation, attempt, lastFailure);
            }
            Duration slice = remaining.compareTo(policy.getPollInterval()) < 0 ? remaining : policy.getPollInterval();
            try {
                sleeper.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(operation, attempt, lastFailure);
            }
            remaining = remaining.minus(slice);
        }
        if (cancellationToken.isCancelled()) {
            throw cancelled(operation, attempt, lastFailure);
        }
    }

    private RetryCancelledException cancelled(String operation, int attempt, Throwable lastFailure) {
        log.warn("[RETRY] {} cancelled during backoff after attempt {}", operation, attempt);
        return new RetryCancelledException(operation, attempt, lastFailure);
    }

    private static String messageOf(Throwable failure) {
        return failure != null ? failure.getMessage() : null;
    }
}
