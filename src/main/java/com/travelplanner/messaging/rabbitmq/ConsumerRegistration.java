package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import com.travelplanner.messaging.JobHandler;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One active subscription: queue, decoded job type, handler, concurrency limit (the channel
 * prefetch) and the broker-assigned consumer tag while subscribed.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class ConsumerRegistration<T> {

    @ToString.Include
    private final String queue;
    private final Class<T> type;
    private final JobHandler<? super T> handler;
    @ToString.Include
    private final int concurrencyLimit;

    @Nullable
    @ToString.Include
    private volatile String consumerTag;

    @Nullable
    private volatile Channel channel;

    private final AtomicInteger inFlight = new AtomicInteger();

    ConsumerRegistration(String queue, Class<T> type, JobHandler<? super T> handler, int concurrencyLimit) {
        this.queue = queue;
        this.type = type;
        this.handler = handler;
        this.concurrencyLimit = concurrencyLimit;
    }

    public boolean isActive() {
        Channel current = channel;
        return consumerTag != null && current != null && current.isOpen();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    void activate(Channel channel, String consumerTag) {
        this.channel = channel;
        this.consumerTag = consumerTag;
    }

    void deactivate() {
        this.consumerTag = null;
        this.channel = null;
    }

    int enter() {
        return inFlight.incrementAndGet();
    }

    void exit() {
        inFlight.decrementAndGet();
    }
}
