package com.travelplanner.messaging.rabbitmq;

import lombok.Builder;
import lombok.Value;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative description of a job queue and its dead-letter plumbing.
 *
 * <p>When {@link #deadLetterExchange} is set the main queue is declared with
 * {@code x-dead-letter-exchange} and {@code x-dead-letter-routing-key}; the routing key
 * defaults to the queue name.
 */
@Value
@Builder(toBuilder = true)
public class QueueTopology {

    static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String ARG_DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String ARG_MESSAGE_TTL = "x-message-ttl";

    String queueName;

    @Builder.Default
    boolean durable = true;

    @Nullable
    String deadLetterExchange;

    @Nullable
    String deadLetterQueue;

    @Nullable
    String deadLetterRoutingKey;

    /** Optional per-queue message TTL in milliseconds. */
    @Nullable
    Long messageTtl;

    public static QueueTopology plain(String queueName) {
        return QueueTopology.builder().queueName(queueName).build();
    }

    /**
     * Topology for a job family following the naming convention
     * {@code <domain>_job_queue}, {@code <domain>_job_dlx}, {@code <domain>_job_dlx_queue}.
     */
    public static QueueTopology forDomain(String domain) {
        return QueueTopology.builder()
                .queueName(JobQueueNames.queue(domain))
                .deadLetterExchange(JobQueueNames.deadLetterExchange(domain))
                .deadLetterQueue(JobQueueNames.deadLetterQueue(domain))
                .build();
    }

    public boolean hasDeadLetterExchange() {
        return deadLetterExchange != null && !deadLetterExchange.isBlank();
    }

    public boolean hasDeadLetterQueue() {
        return hasDeadLetterExchange() && deadLetterQueue != null && !deadLetterQueue.isBlank();
    }

    public String effectiveDeadLetterRoutingKey() {
        return deadLetterRoutingKey != null && !deadLetterRoutingKey.isBlank() ? deadLetterRoutingKey : queueName;
    }

    /**
     * Arguments used when declaring the main queue.
     */
    public Map<String, Object> queueArguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        if (hasDeadLetterExchange()) {
            args.put(ARG_DEAD_LETTER_EXCHANGE, deadLetterExchange);
            args.put(ARG_DEAD_LETTER_ROUTING_KEY, effectiveDeadLetterRoutingKey());
        }
        if (messageTtl != null) {
            args.put(ARG_MESSAGE_TTL, messageTtl);
        }
        return Collections.unmodifiableMap(args);
    }
}
