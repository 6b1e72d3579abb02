package com.travelplanner.messaging.retry;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff: {@code min(initialDelay * 2^attempt, maxDelay) + jitter}.
 *
 * <p>The jitter is drawn uniformly from {@code [0, maxJitter)}. The jitter source is
 * replaceable so tests can pin it.
 */
@Getter
@ToString
public class ExponentialBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Duration maxJitter;

    @ToString.Exclude
    private final LongUnaryOperator jitterSource;

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay, Duration maxJitter) {
        this(initialDelay, maxDelay, maxJitter,
                bound -> bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound));
    }

    public ExponentialBackoff(Duration initialDelay,
                              Duration maxDelay,
                              Duration maxJitter,
                              LongUnaryOperator jitterSource) {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.maxJitter = maxJitter != null ? maxJitter : Duration.ZERO;
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");

        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                    "Invalid backoff: initialDelay=" + initialDelay + " maxDelay=" + maxDelay);
        }
    }

    /**
     * Backoff without a cap or jitter, i.e. exactly {@code base * 2^exponent}.
     */
    public static ExponentialBackoff uncapped(Duration base) {
        return new ExponentialBackoff(base, Duration.ofMillis(Long.MAX_VALUE), Duration.ZERO, bound -> 0);
    }

    /**
     * Delay before the attempt that follows {@code attempt} failures (zero-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0 but was " + attempt);
        }
        long capped = Math.min(scale(initialDelay.toMillis(), attempt), maxDelay.toMillis());
        long jitter = jitterSource.applyAsLong(maxJitter.toMillis());
        return Duration.ofMillis(saturatedAdd(capped, jitter));
    }

    static long scale(long base, int exponent) {
        if (base == 0) {
            return 0;
        }
        if (exponent >= Long.SIZE - 1 || base > (Long.MAX_VALUE >> exponent)) {
            return Long.MAX_VALUE;
        }
        return base << exponent;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
