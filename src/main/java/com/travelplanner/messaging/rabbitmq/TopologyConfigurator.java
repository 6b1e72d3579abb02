package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.travelplanner.messaging.exception.TopologyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares job queues together with their dead-letter exchange and dead-letter queue.
 *
 * <p>Declaration order is fixed:
 * <ol>
 *     <li>dead-letter exchange (direct, durable)</li>
 *     <li>dead-letter queue, bound to the exchange with the dead-letter routing key</li>
 *     <li>main queue, with {@code x-dead-letter-*} arguments pointing at the exchange</li>
 * </ol>
 * so a message rejected from the main queue always has somewhere to land.
 *
 * <p>Repeating a declaration with identical parameters is a no-op. A conflicting redeclaration
 * fails with {@link TopologyException} instead of silently replacing what was declared.
 */
@Slf4j
public class TopologyConfigurator {

    private final ChannelPool channelPool;
    private final TopologyRegistry registry;

    public TopologyConfigurator(ChannelPool channelPool, TopologyRegistry registry) {
        this.channelPool = Objects.requireNonNull(channelPool, "channelPool must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public void setupQueueWithDlx(String queueName,
                                  @Nullable String deadLetterExchange,
                                  @Nullable String deadLetterQueue,
                                  @Nullable String deadLetterRoutingKey) {
        setupQueueWithDlx(QueueTopology.builder()
                .queueName(queueName)
                .deadLetterExchange(deadLetterExchange)
                .deadLetterQueue(deadLetterQueue)
                .deadLetterRoutingKey(deadLetterRoutingKey)
                .build());
    }

    public void setupQueueWithDlx(QueueTopology topology) {
        Objects.requireNonNull(topology, "topology must not be null");
        String queueName = topology.getQueueName();
        if (queueName == null || queueName.isBlank()) {
            throw new TopologyException("Queue name must not be blank");
        }

        QueueTopology existing = registry.find(queueName);
        if (existing != null) {
            if (existing.equals(topology)) {
                log.debug("Queue [{}] already declared with identical topology", queueName);
                return;
            }
            throw conflict(existing, topology);
        }

        declare(topology);

        // a concurrent declaration of the same queue may have been recorded meanwhile
        QueueTopology raced = registry.recordIfAbsent(topology);
        if (raced != null && !raced.equals(topology)) {
            throw conflict(raced, topology);
        }
    }

    private static TopologyException conflict(QueueTopology declared, QueueTopology requested) {
        return new TopologyException("Conflicting topology for queue [" + requested.getQueueName()
                + "]: declared=" + declared + " requested=" + requested);
    }

    /**
     * Re-runs every declaration made by this process, e.g. after the broker connection was
     * re-established.
     */
    public void redeclareAll(List<String> queueNames) {
        for (String queueName : new ArrayList<>(queueNames)) {
            QueueTopology topology = registry.find(queueName);
            if (topology != null) {
                declare(topology);
            }
        }
    }

    private void declare(QueueTopology topology) {
        String queueName = topology.getQueueName();
        ChannelKey key = ChannelKey.setup(queueName);
        Channel channel = channelPool.getOrCreate(key);

        log.info("Setting up queue [{}] with DLX config...", queueName);
        try {
            if (topology.hasDeadLetterExchange()) {
                channel.exchangeDeclare(topology.getDeadLetterExchange(), BuiltinExchangeType.DIRECT, true);
                log.info("Dead Letter Exchange [{}] declared", topology.getDeadLetterExchange());
            }

            if (topology.hasDeadLetterQueue()) {
                channel.queueDeclare(topology.getDeadLetterQueue(), true, false, false, null);
                channel.queueBind(topology.getDeadLetterQueue(),
                        topology.getDeadLetterExchange(),
                        topology.effectiveDeadLetterRoutingKey());
                log.info("Dead Letter Queue [{}] bound to DLX [{}] with key [{}]",
                        topology.getDeadLetterQueue(),
                        topology.getDeadLetterExchange(),
                        topology.effectiveDeadLetterRoutingKey());
            }

            channel.queueDeclare(queueName, topology.isDurable(), false, false, topology.queueArguments());
            log.info("Main queue [{}] declared with arguments {}", queueName, topology.queueArguments());

        } catch (IOException | RuntimeException e) {
            // a failed declaration closes the channel on the broker side
            channelPool.evict(key);
            log.error("Failed to set up queue [{}] with DLX", queueName, e);
            throw new TopologyException("Failed to set up queue [" + queueName + "]", e);
        }
    }
}
