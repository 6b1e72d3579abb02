package com.travelplanner.messaging.internal;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.Nullable;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer recording for publish, consume and retry outcomes. Every method is a no-op when
 * no registry is available.
 */
public class MessagingMetrics {

    public static final MessagingMetrics NOOP = new MessagingMetrics(null);

    @Nullable
    private final MeterRegistry meterRegistry;

    public MessagingMetrics(@Nullable MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void publishSucceeded(String queue) {
        increment("jobs.publish.success", queue);
    }

    public void publishFailed(String queue) {
        increment("jobs.publish.failure", queue);
    }

    public void publishBackpressure(String queue) {
        increment("jobs.publish.backpressure", queue);
    }

    public void consumeSucceeded(String queue, long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer("jobs.consume.latency", "queue", queue)
                .record(durationNs, TimeUnit.NANOSECONDS);
        increment("jobs.consume.success", queue);
    }

    /** Handler returned {@code false}. */
    public void consumeRejected(String queue) {
        increment("jobs.consume.rejected", queue);
    }

    /** Handler threw or the body could not be decoded. */
    public void consumeFailed(String queue) {
        increment("jobs.consume.failure", queue);
    }

    public void retryScheduled(String queue) {
        increment("jobs.retry.scheduled", queue);
    }

    public void retryExhausted(String queue) {
        increment("jobs.retry.exhausted", queue);
    }

    public void registerInFlightGauge(String queue, Supplier<Number> inFlight) {
        if (meterRegistry == null) return;

        Gauge.builder("jobs.consume.in-flight", inFlight)
                .tag("queue", queue)
                .register(meterRegistry);
    }

    private void increment(String name, String queue) {
        if (meterRegistry == null) return;

        meterRegistry.counter(name, "queue", queue).increment();
    }
}
