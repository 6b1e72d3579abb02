package com.travelplanner.messaging.retry;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Budget and cadence of application-level retries for one job family.
 *
 * <p>The {@code k}-th retry (attempt {@code k}, starting at 1) waits
 * {@code baseDelay * 2^(k-1)}. A failed delivery whose attempt number reaches
 * {@code maxRetries} is not retried.
 */
@Getter
@ToString
public class RetryPolicy {

    public static final int DEFAULT_MAX_PENDING_RETRIES = 1000;

    private final int maxRetries;
    private final Duration baseDelay;
    private final int maxPendingRetries;

    @ToString.Exclude
    private final Predicate<Throwable> retryableFailure;

    @ToString.Exclude
    private final ExponentialBackoff backoff;

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        this(maxRetries, baseDelay, DEFAULT_MAX_PENDING_RETRIES, failure -> true);
    }

    /**
     * @param maxPendingRetries cap on retries scheduled but not yet republished, per job key
     * @param retryableFailure  decides whether a thrown failure may be retried; a handler
     *                          returning {@code false} is always retryable
     */
    public RetryPolicy(int maxRetries,
                       Duration baseDelay,
                       int maxPendingRetries,
                       Predicate<Throwable> retryableFailure) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1 but was " + maxRetries);
        }
        if (maxPendingRetries < 1) {
            throw new IllegalArgumentException("maxPendingRetries must be >= 1 but was " + maxPendingRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxPendingRetries = maxPendingRetries;
        this.retryableFailure = Objects.requireNonNull(retryableFailure, "retryableFailure must not be null");
        this.backoff = ExponentialBackoff.uncapped(baseDelay);
    }

    public boolean hasBudgetFor(int attempt) {
        return attempt < maxRetries;
    }

    public boolean isRetryable(Throwable failure) {
        return retryableFailure.test(failure);
    }

    /**
     * Delay before republishing after failed attempt {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
        return backoff.delayFor(attempt - 1);
    }
}
