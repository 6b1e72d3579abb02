package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.MessageProperties;
import com.travelplanner.messaging.exception.JobSerializationException;
import com.travelplanner.messaging.internal.JobCodec;
import com.travelplanner.messaging.internal.MessagingMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Serializes jobs and sends them to a queue through the default exchange.
 *
 * <p><b>Contract:</b> every publish returns {@code true} only when the broker accepted the
 * message (confirmed, when publisher confirms are on). Broker flow control is honored by
 * waiting for the connection to drain before sending; if it does not drain in time the
 * publish returns {@code false}. Failures are logged and reported as {@code false}, never
 * thrown: the caller decides whether to retry.
 */
@Slf4j
public class JobPublisher {

    private static final String CONTENT_TYPE = "application/json";
    private static final String DEFAULT_EXCHANGE = "";

    private final ConnectionManager connectionManager;
    private final ChannelPool channelPool;
    private final JobCodec codec;
    private final MessagingMetrics metrics;

    private final boolean confirms;
    private final Duration confirmTimeout;
    private final Duration drainTimeout;

    public JobPublisher(ConnectionManager connectionManager,
                        ChannelPool channelPool,
                        JobCodec codec,
                        MessagingMetrics metrics,
                        boolean confirms,
                        Duration confirmTimeout,
                        Duration drainTimeout) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
        this.channelPool = Objects.requireNonNull(channelPool, "channelPool must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.metrics = metrics != null ? metrics : MessagingMetrics.NOOP;
        this.confirms = confirms;
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout must not be null");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
    }

    public boolean publish(String queue, Object job) {
        return publish(queue, job, PublishOptions.defaults());
    }

    public boolean publish(String queue, Object job, PublishOptions options) {
        return publishAll(queue, Collections.singletonList(job), options);
    }

    public boolean publishAll(String queue, List<?> jobs) {
        return publishAll(queue, jobs, PublishOptions.defaults());
    }

    /**
     * Publishes all jobs on one channel. Returns {@code true} only if every message was accepted.
     */
    public boolean publishAll(String queue, List<?> jobs, PublishOptions options) {
        Objects.requireNonNull(queue, "queue must not be null");
        if (jobs == null || jobs.isEmpty()) {
            return true;
        }

        List<byte[]> bodies = new ArrayList<>(jobs.size());
        try {
            for (Object job : jobs) {
                bodies.add(codec.encode(job));
            }
        } catch (JobSerializationException e) {
            log.error("Refusing to publish unserializable job to queue {}", queue, e);
            metrics.publishFailed(queue);
            return false;
        }

        try {
            if (!awaitWritable(queue)) {
                metrics.publishBackpressure(queue);
                return false;
            }

            Channel channel = channelPool.getOrCreate(ChannelKey.publish(queue));

            // channels are not safe for concurrent publishing
            synchronized (channel) {
                for (byte[] body : bodies) {
                    channel.basicPublish(DEFAULT_EXCHANGE, queue, properties(options), body);
                }
                if (confirms && !channel.waitForConfirms(confirmTimeout.toMillis())) {
                    log.error("Broker nacked {} message(s) published to queue {}", bodies.size(), queue);
                    metrics.publishFailed(queue);
                    return false;
                }
            }

            log.debug("Published {} message(s) to queue {}", bodies.size(), queue);
            metrics.publishSucceeded(queue);
            return true;

        } catch (TimeoutException e) {
            log.warn("Publish to queue {} not confirmed within {}ms", queue, confirmTimeout.toMillis());
            metrics.publishBackpressure(queue);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing to queue {}", queue);
            metrics.publishFailed(queue);
            return false;
        } catch (IOException | RuntimeException e) {
            log.error("Error publishing message(s) to queue {}", queue, e);
            metrics.publishFailed(queue);
            return false;
        }
    }

    private boolean awaitWritable(String queue) throws InterruptedException {
        if (!connectionManager.isBlocked()) {
            return true;
        }
        log.warn("RabbitMQ connection blocked, waiting up to {}ms to publish to queue {}",
                drainTimeout.toMillis(), queue);
        boolean drained = connectionManager.awaitUnblocked(drainTimeout);
        if (drained) {
            log.info("RabbitMQ connection drained, publishing to queue {}", queue);
        } else {
            log.warn("RabbitMQ connection still blocked after {}ms, publish to queue {} rejected",
                    drainTimeout.toMillis(), queue);
        }
        return drained;
    }

    private AMQP.BasicProperties properties(PublishOptions options) {
        String messageId = options.getMessageId() != null
                ? options.getMessageId()
                : UUID.randomUUID().toString();

        return MessageProperties.PERSISTENT_BASIC.builder()
                .contentType(CONTENT_TYPE)
                .contentEncoding("UTF-8")
                .messageId(messageId)
                .timestamp(new Date())
                .headers(options.getHeaders().isEmpty() ? null : new HashMap<>(options.getHeaders()))
                .expiration(options.getExpiration())
                .build();
    }
}
