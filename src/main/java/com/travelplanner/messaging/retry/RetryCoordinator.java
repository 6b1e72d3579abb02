package com.travelplanner.messaging.retry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.travelplanner.messaging.JobHandler;
import com.travelplanner.messaging.RetryableJob;
import com.travelplanner.messaging.exception.JobSerializationException;
import com.travelplanner.messaging.exception.RetryDeferredException;
import com.travelplanner.messaging.internal.JobCodec;
import com.travelplanner.messaging.internal.MessagingMetrics;
import com.travelplanner.messaging.rabbitmq.JobPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator adding bounded, application-level retry to a {@link JobHandler}.
 *
 * <p>When the delegate fails (returns {@code false} or throws) on attempt
 * {@code n = retryCount + 1}:
 * <ul>
 *     <li>{@code n < maxRetries}: waits {@code baseDelay * 2^(n-1)}, then publishes a copy of the
 *     job body with {@code retryCount = n} to the same queue</li>
 *     <li>otherwise nothing is republished</li>
 * </ul>
 * The failure is passed on only after the copy is confirmed, so the consumer rejects the original
 * delivery without requeue once the retry is durable. Until then the original stays unacknowledged
 * and occupies one slot of the consumer's concurrency limit.
 *
 * <p>If the copy cannot be published, or the wait is interrupted, a
 * {@link RetryDeferredException} asks the consumer to requeue the original instead.
 *
 * @param <T> job type carrying the {@code retryCount} attempt counter
 */
@Slf4j
public class RetryCoordinator<T extends RetryableJob> implements JobHandler<T> {

    static final String RETRY_COUNT_FIELD = "retryCount";

    /** Waits out a backoff delay on the handler thread. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final JobHandler<? super T> delegate;
    private final String queue;
    private final RetryPolicy policy;
    private final JobPublisher publisher;
    private final JobCodec codec;
    private final MessagingMetrics metrics;
    private final Sleeper sleeper;

    /** Retries waiting out their backoff, per job key. */
    private final Map<String, AtomicInteger> backlog = new ConcurrentHashMap<>();

    public RetryCoordinator(JobHandler<? super T> delegate,
                            String queue,
                            RetryPolicy policy,
                            JobPublisher publisher,
                            JobCodec codec,
                            MessagingMetrics metrics) {
        this(delegate, queue, policy, publisher, codec, metrics,
                delay -> TimeUnit.MILLISECONDS.sleep(delay.toMillis()));
    }

    RetryCoordinator(JobHandler<? super T> delegate,
                     String queue,
                     RetryPolicy policy,
                     JobPublisher publisher,
                     JobCodec codec,
                     MessagingMetrics metrics,
                     Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.metrics = metrics != null ? metrics : MessagingMetrics.NOOP;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public boolean handle(T job) throws Exception {
        Exception failure = null;
        try {
            if (delegate.handle(job)) {
                return true;
            }
        } catch (Exception e) {
            failure = e;
        }

        int attempt = (job.getRetryCount() != null ? job.getRetryCount() : 0) + 1;

        if (failure != null && !policy.isRetryable(failure)) {
            log.error("Non-retryable failure for job {} on queue {} (attempt {}). Moving to DLQ.",
                    job.retryKey(), queue, attempt);
            metrics.retryExhausted(queue);
        } else if (policy.hasBudgetFor(attempt)) {
            retry(job, attempt, failure);
        } else {
            log.error("Maximum retries ({}) reached for job {} on queue {}. Moving to DLQ.",
                    policy.getMaxRetries(), job.retryKey(), queue);
            metrics.retryExhausted(queue);
        }

        if (failure != null) {
            throw failure;
        }
        return false;
    }

    private void retry(T job, int attempt, Exception failure) {
        String key = job.retryKey();
        AtomicInteger pending = backlog.computeIfAbsent(key, k -> new AtomicInteger());

        if (pending.incrementAndGet() > policy.getMaxPendingRetries()) {
            pending.decrementAndGet();
            log.error("Retry backlog for job {} on queue {} is full ({}). Moving to DLQ.",
                    key, queue, policy.getMaxPendingRetries());
            metrics.retryExhausted(queue);
            return;
        }

        try {
            ObjectNode copy;
            try {
                copy = codec.toTree(job);
                copy.put(RETRY_COUNT_FIELD, attempt);
            } catch (JobSerializationException e) {
                log.error("Cannot build retry copy of job {} for queue {}", key, queue, e);
                return;
            }

            Duration delay = policy.delayFor(attempt);
            log.warn("Retrying job {} on queue {} in {}ms (attempt {}).", key, queue, delay.toMillis(), attempt + 1);
            metrics.retryScheduled(queue);

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting to retry job {} on queue {}, requeueing the original", key, queue);
                throw deferred(key, failure);
            }

            if (!publisher.publish(queue, copy)) {
                log.error("Failed to republish job {} to queue {} with retryCount={}, requeueing the original",
                        key, queue, attempt);
                throw deferred(key, failure);
            }
            log.info("Republished job {} to queue {} with retryCount={}", key, queue, attempt);
        } finally {
            pending.decrementAndGet();
        }
    }

    private RetryDeferredException deferred(String key, Exception failure) {
        return new RetryDeferredException(
                "Retry copy of job " + key + " was not published to queue " + queue, failure);
    }

    /**
     * Retries currently waiting out their backoff, per job key.
     */
    public int pendingRetries(String key) {
        AtomicInteger pending = backlog.get(key);
        return pending != null ? pending.get() : 0;
    }
}
