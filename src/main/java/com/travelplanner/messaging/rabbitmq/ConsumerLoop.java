package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.travelplanner.messaging.JobHandler;
import com.travelplanner.messaging.exception.ChannelException;
import com.travelplanner.messaging.exception.JobSerializationException;
import com.travelplanner.messaging.exception.RetryDeferredException;
import com.travelplanner.messaging.internal.JobCodec;
import com.travelplanner.messaging.internal.MessagingMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Manual-ack consumers with a bounded number of unacknowledged deliveries.
 *
 * <p>The concurrency limit of a subscription is the channel prefetch: the broker never hands
 * more than that many unacknowledged deliveries to the consumer, so at most that many handler
 * invocations are pending at once. Handlers run on the supplied executor.
 *
 * <p><b>Per delivery:</b></p>
 * <ol>
 *     <li>decode and validate the body; failure is permanent, the delivery is dead-lettered</li>
 *     <li>invoke the handler</li>
 *     <li>{@code true} acknowledges; {@code false} or an exception rejects without requeue</li>
 *     <li>a {@link RetryDeferredException} requeues, since the job's retry copy was never published</li>
 * </ol>
 * Broker-native redelivery is never used; retries come from a wrapping
 * {@link com.travelplanner.messaging.retry.RetryCoordinator}.
 *
 * <p>Subscriptions survive a connection loss and are re-established when the connection comes
 * back. A consumer cancelled by the broker (for example because its queue was deleted)
 * deregisters itself.
 */
@Slf4j
public class ConsumerLoop implements ConnectionStateListener {

    private final ChannelPool channelPool;
    private final TopologyConfigurator topologyConfigurator;
    private final JobCodec codec;
    private final Executor handlerExecutor;
    private final MessagingMetrics metrics;

    /** Active registrations keyed by queue name. */
    private final Map<String, ConsumerRegistration<?>> registrations = new ConcurrentHashMap<>();

    public ConsumerLoop(ChannelPool channelPool,
                        TopologyConfigurator topologyConfigurator,
                        JobCodec codec,
                        Executor handlerExecutor,
                        MessagingMetrics metrics) {
        this.channelPool = Objects.requireNonNull(channelPool, "channelPool must not be null");
        this.topologyConfigurator = Objects.requireNonNull(topologyConfigurator, "topologyConfigurator must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor must not be null");
        this.metrics = metrics != null ? metrics : MessagingMetrics.NOOP;
    }

    // =====================================================================
    // SUBSCRIBE
    // =====================================================================

    /**
     * Starts consuming {@code queue}. At most one registration per queue is allowed.
     *
     * @throws IllegalStateException if the queue already has a consumer
     * @throws ChannelException      if the consumer could not be started
     */
    public <T> ConsumerRegistration<T> subscribe(String queue,
                                                 Class<T> type,
                                                 JobHandler<? super T> handler,
                                                 int concurrencyLimit) {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1 but was " + concurrencyLimit);
        }

        ConsumerRegistration<T> registration = new ConsumerRegistration<>(queue, type, handler, concurrencyLimit);
        if (registrations.putIfAbsent(queue, registration) != null) {
            log.warn("Consumer already exists for queue {}", queue);
            throw new IllegalStateException("Consumer already registered for queue " + queue);
        }

        try {
            start(registration);
        } catch (RuntimeException e) {
            registrations.remove(queue, registration);
            log.error("Error setting up consumer for queue {}", queue, e);
            throw e;
        }

        metrics.registerInFlightGauge(queue, registration::getInFlight);
        return registration;
    }

    private void start(ConsumerRegistration<?> registration) {
        String queue = registration.getQueue();
        ChannelKey key = ChannelKey.consume(queue);
        Channel channel = channelPool.getOrCreate(key);

        try {
            channel.basicQos(registration.getConcurrencyLimit());
            String consumerTag = channel.basicConsume(queue, false, new DeliveryConsumer(channel, registration));
            registration.activate(channel, consumerTag);
            log.info("Consumer started for queue {} with concurrency {} (tag={})",
                    queue, registration.getConcurrencyLimit(), consumerTag);
        } catch (IOException | RuntimeException e) {
            channelPool.evict(key);
            throw new ChannelException("Failed to start consumer for queue " + queue, e);
        }
    }

    /**
     * Cancels the consumer of {@code queue}. In-flight handlers still complete and settle.
     */
    public void unsubscribe(String queue) {
        ConsumerRegistration<?> registration = registrations.remove(queue);
        if (registration != null) {
            cancel(registration);
        }
    }

    public Collection<ConsumerRegistration<?>> getRegistrations() {
        return Collections.unmodifiableCollection(registrations.values());
    }

    public boolean isSubscribed(String queue) {
        return registrations.containsKey(queue);
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    private <T> void process(ConsumerRegistration<T> registration,
                             Channel channel,
                             long deliveryTag,
                             AMQP.BasicProperties properties,
                             byte[] body) {
        String queue = registration.getQueue();
        String messageId = properties != null ? properties.getMessageId() : null;
        long start = System.nanoTime();

        try {
            T job;
            try {
                job = codec.decode(body, registration.getType());
            } catch (JobSerializationException e) {
                log.error("Failed to parse message content (queue={} messageId={}), dead-lettering",
                        queue, messageId, e);
                metrics.consumeFailed(queue);
                reject(channel, deliveryTag, queue);
                return;
            }

            boolean success;
            try {
                success = registration.getHandler().handle(job);
            } catch (RetryDeferredException e) {
                log.warn("Retry of message from queue {} not published. NACKing (requeue). messageId={}",
                        queue, messageId, e);
                metrics.consumeFailed(queue);
                requeue(channel, deliveryTag, queue);
                return;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.error("Error processing message from queue {}. NACKing (no requeue). messageId={}",
                        queue, messageId, e);
                metrics.consumeFailed(queue);
                reject(channel, deliveryTag, queue);
                return;
            }

            if (success) {
                ack(channel, deliveryTag, queue);
                metrics.consumeSucceeded(queue, System.nanoTime() - start);
            } else {
                log.warn("Processing callback returned false. NACKing (no requeue). queue={} messageId={}",
                        queue, messageId);
                metrics.consumeRejected(queue);
                reject(channel, deliveryTag, queue);
            }
        } finally {
            registration.exit();
        }
    }

    private void ack(Channel channel, long deliveryTag, String queue) {
        try {
            channel.basicAck(deliveryTag, false);
            log.debug("ACK sent (queue={} tag={})", queue, deliveryTag);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to ack delivery (queue={} tag={}); the broker will redeliver it",
                    queue, deliveryTag, e);
        }
    }

    private void reject(Channel channel, long deliveryTag, String queue) {
        try {
            channel.basicNack(deliveryTag, false, false);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to reject delivery (queue={} tag={}); the broker will redeliver it",
                    queue, deliveryTag, e);
        }
    }

    private void requeue(Channel channel, long deliveryTag, String queue) {
        try {
            channel.basicNack(deliveryTag, false, true);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to requeue delivery (queue={} tag={})", queue, deliveryTag, e);
        }
    }

    private final class DeliveryConsumer extends DefaultConsumer {

        private final ConsumerRegistration<?> registration;

        DeliveryConsumer(Channel channel, ConsumerRegistration<?> registration) {
            super(channel);
            this.registration = registration;
        }

        @Override
        public void handleDelivery(String consumerTag,
                                   Envelope envelope,
                                   AMQP.BasicProperties properties,
                                   byte[] body) {
            Channel channel = getChannel();
            long deliveryTag = envelope.getDeliveryTag();

            registration.enter();
            try {
                handlerExecutor.execute(() -> process(registration, channel, deliveryTag, properties, body));
            } catch (RejectedExecutionException e) {
                registration.exit();
                log.warn("Handler executor rejected delivery (queue={} tag={}), requeueing",
                        registration.getQueue(), deliveryTag);
                requeue(channel, deliveryTag, registration.getQueue());
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Consumer for queue {} cancelled by broker (tag={}), possibly due to queue deletion",
                    registration.getQueue(), consumerTag);
            registrations.remove(registration.getQueue(), registration);
            registration.deactivate();
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (registration.getChannel() != getChannel()) {
                // already resubscribed on a newer channel
                return;
            }
            registration.deactivate();
            if (sig.isInitiatedByApplication() || registrations.get(registration.getQueue()) != registration) {
                return;
            }
            if (sig.isHardError()) {
                log.warn("Consumer for queue {} lost its connection; it will resume after reconnect",
                        registration.getQueue());
                return;
            }
            log.warn("Consumer channel for queue {} closed: {}; resubscribing",
                    registration.getQueue(), sig.getMessage());
            handlerExecutor.execute(() -> resubscribe(registration));
        }
    }

    // =====================================================================
    // RECOVERY
    // =====================================================================

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current, Throwable cause) {
        if (current != ConnectionState.CONNECTED) {
            return;
        }
        List<ConsumerRegistration<?>> inactive = new ArrayList<>();
        for (ConsumerRegistration<?> registration : registrations.values()) {
            if (!registration.isActive()) {
                inactive.add(registration);
            }
        }
        if (inactive.isEmpty()) {
            return;
        }

        log.info("Re-establishing {} consumer(s) after reconnect", inactive.size());
        List<String> queues = new ArrayList<>();
        inactive.forEach(r -> queues.add(r.getQueue()));
        try {
            topologyConfigurator.redeclareAll(queues);
        } catch (RuntimeException e) {
            log.error("Failed to re-declare topology after reconnect for queues {}", queues, e);
        }
        inactive.forEach(this::resubscribe);
    }

    private void resubscribe(ConsumerRegistration<?> registration) {
        if (registrations.get(registration.getQueue()) != registration || registration.isActive()) {
            return;
        }
        try {
            start(registration);
        } catch (RuntimeException e) {
            log.error("Failed to re-establish consumer for queue {}", registration.getQueue(), e);
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Cancels every consumer and waits up to {@code drainTimeout} for in-flight handlers.
     *
     * @return {@code true} if all handlers finished in time
     */
    public boolean shutdown(Duration drainTimeout) {
        log.info("Stopping {} consumer(s)...", registrations.size());
        List<ConsumerRegistration<?>> stopping = new ArrayList<>(registrations.values());
        registrations.clear();
        stopping.forEach(this::cancel);

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (inFlight(stopping) > 0) {
            if (System.nanoTime() >= deadline) {
                log.warn("{} handler invocation(s) still running after {}ms",
                        inFlight(stopping), drainTimeout.toMillis());
                return false;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private static int inFlight(List<ConsumerRegistration<?>> registrations) {
        return registrations.stream().mapToInt(ConsumerRegistration::getInFlight).sum();
    }

    private void cancel(ConsumerRegistration<?> registration) {
        Channel channel = registration.getChannel();
        String consumerTag = registration.getConsumerTag();
        registration.deactivate();
        if (channel == null || consumerTag == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.basicCancel(consumerTag);
            log.info("Stopped consumer for queue {} (tag={})", registration.getQueue(), consumerTag);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to cancel consumer for queue {} (tag={})", registration.getQueue(), consumerTag, e);
        }
    }
}
