package com.travelplanner.messaging.rabbitmq;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topologies declared by this process, keyed by main queue name.
 *
 * <p>Shared by {@link TopologyConfigurator} (writes) and {@link ChannelPool} (reads, to re-assert
 * a queue on publish channels with the same arguments it was declared with).
 */
public class TopologyRegistry {

    private final Map<String, QueueTopology> declared = new ConcurrentHashMap<>();

    @Nullable
    public QueueTopology find(String queueName) {
        return declared.get(queueName);
    }

    /**
     * Records the topology unless one is already present.
     *
     * @return the previously recorded topology, or {@code null} if this call recorded it
     */
    @Nullable
    QueueTopology recordIfAbsent(QueueTopology topology) {
        return declared.putIfAbsent(topology.getQueueName(), topology);
    }

    public int size() {
        return declared.size();
    }
}
