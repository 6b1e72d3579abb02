package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.travelplanner.messaging.exception.ChannelException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Lazily created, per-purpose channels bound to the current connection.
 *
 * <p>Creation is atomic per key: concurrent callers asking for the same {@link ChannelKey} get
 * the same channel. A channel that reports shutdown is evicted and transparently recreated on
 * the next {@link #getOrCreate} call. Channels of other keys are not affected.
 */
@Slf4j
public class ChannelPool implements ConnectionStateListener {

    private final ConnectionManager connectionManager;
    private final TopologyRegistry topologyRegistry;
    private final boolean publisherConfirms;

    private final Map<ChannelKey, Channel> channels = new ConcurrentHashMap<>();

    public ChannelPool(ConnectionManager connectionManager,
                       TopologyRegistry topologyRegistry,
                       boolean publisherConfirms) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
        this.topologyRegistry = Objects.requireNonNull(topologyRegistry, "topologyRegistry must not be null");
        this.publisherConfirms = publisherConfirms;
    }

    /**
     * Returns the open channel cached for {@code key}, creating it if needed. Publish channels
     * assert their queue on creation and are put in confirm mode when confirms are enabled.
     *
     * @throws com.travelplanner.messaging.exception.ConnectionUnavailableException if no connection is open
     * @throws ChannelException if the channel could not be opened or prepared
     */
    public Channel getOrCreate(ChannelKey key) {
        Channel cached = channels.get(key);
        if (cached != null && cached.isOpen()) {
            return cached;
        }

        Connection connection = connectionManager.requireConnection();

        return channels.compute(key, (k, existing) -> {
            if (existing != null && existing.isOpen()) {
                return existing;
            }
            return openChannel(connection, k);
        });
    }

    private Channel openChannel(Connection connection, ChannelKey key) {
        Channel channel = null;
        try {
            channel = connection.createChannel();
            if (channel == null) {
                throw new IOException("No channel number available");
            }

            Channel created = channel;
            if (key.getRole() == ChannelKey.Role.PUBLISH) {
                assertQueue(created, key.getQueue());
                if (publisherConfirms) {
                    created.confirmSelect();
                }
            }
            created.addShutdownListener(cause -> onChannelShutdown(key, created, cause));

            log.info("Created RabbitMQ channel {}", key);
            return created;

        } catch (IOException | RuntimeException e) {
            closeQuietly(key, channel);
            log.error("Failed to create RabbitMQ channel {}", key, e);
            throw new ChannelException("Failed to create channel " + key, e);
        }
    }

    private void assertQueue(Channel channel, String queue) throws IOException {
        QueueTopology topology = topologyRegistry.find(queue);
        if (topology != null) {
            channel.queueDeclare(queue, topology.isDurable(), false, false, topology.queueArguments());
        } else {
            channel.queueDeclare(queue, true, false, false, null);
        }
    }

    private void onChannelShutdown(ChannelKey key, Channel channel, ShutdownSignalException cause) {
        if (!channels.remove(key, channel)) {
            return;
        }
        if (cause.isInitiatedByApplication()) {
            log.debug("RabbitMQ channel {} closed", key);
        } else {
            log.warn("RabbitMQ channel {} closed by broker, evicted: {}", key, cause.getMessage());
        }
    }

    /**
     * Drops a channel so the next request recreates it.
     */
    public void evict(ChannelKey key) {
        Channel removed = channels.remove(key);
        if (removed != null) {
            closeQuietly(key, removed);
        }
    }

    public boolean contains(ChannelKey key) {
        Channel channel = channels.get(key);
        return channel != null && channel.isOpen();
    }

    public int size() {
        return channels.size();
    }

    /**
     * Closes every pooled channel. Invoked before the connection closes.
     */
    public void closeAll() {
        List<ChannelKey> keys = new ArrayList<>(channels.keySet());
        for (ChannelKey key : keys) {
            Channel channel = channels.remove(key);
            if (channel != null) {
                closeQuietly(key, channel);
            }
        }
    }

    @Override
    public void onStateChange(ConnectionState previous, ConnectionState current, Throwable cause) {
        if (current == ConnectionState.CLOSING) {
            closeAll();
        } else if (current == ConnectionState.RECONNECTING || current == ConnectionState.FAILED) {
            // channels died with the connection
            channels.clear();
        }
    }

    private void closeQuietly(ChannelKey key, Channel channel) {
        if (channel == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Failed to close RabbitMQ channel {}", key, e);
        }
    }
}
