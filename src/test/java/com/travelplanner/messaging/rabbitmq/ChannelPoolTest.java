package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.travelplanner.messaging.exception.ChannelException;
import com.travelplanner.messaging.exception.ConnectionUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ChannelPool - per-purpose channel caching and eviction")
class ChannelPoolTest {

    private ConnectionManager connectionManager;
    private Connection connection;
    private TopologyRegistry registry;
    private ChannelPool pool;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = mock(ConnectionManager.class);
        connection = mock(Connection.class);
        registry = new TopologyRegistry();
        when(connectionManager.requireConnection()).thenReturn(connection);
        when(connection.createChannel()).thenAnswer(invocation -> {
            Channel channel = mock(Channel.class);
            when(channel.isOpen()).thenReturn(true);
            return channel;
        });
        pool = new ChannelPool(connectionManager, registry, true);
    }

    private static ShutdownListener shutdownListenerOf(Channel channel) {
        ArgumentCaptor<ShutdownListener> captor = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(channel).addShutdownListener(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("getOrCreate - should cache one channel per key")
    void testCachesPerKey() throws Exception {
        // When
        Channel first = pool.getOrCreate(ChannelKey.consume("email_job_queue"));
        Channel again = pool.getOrCreate(ChannelKey.consume("email_job_queue"));
        Channel setup = pool.getOrCreate(ChannelKey.setup("email_job_queue"));

        // Then
        assertSame(first, again);
        assertNotSame(first, setup);
        assertEquals(2, pool.size());
        verify(connection, times(2)).createChannel();
    }

    @Test
    @DisplayName("getOrCreate - publish channel asserts its queue and enables confirms")
    void testPublishChannelAssertsQueue() throws Exception {
        // When
        Channel channel = pool.getOrCreate(ChannelKey.publish("photo_job_queue"));

        // Then
        verify(channel).queueDeclare("photo_job_queue", true, false, false, null);
        verify(channel).confirmSelect();
    }

    @Test
    @DisplayName("getOrCreate - publish channel re-asserts a declared queue with its dead-letter arguments")
    void testPublishChannelUsesDeclaredTopology() throws Exception {
        // Given
        QueueTopology topology = QueueTopology.forDomain("email");
        registry.recordIfAbsent(topology);

        // When
        Channel channel = pool.getOrCreate(ChannelKey.publish("email_job_queue"));

        // Then
        verify(channel).queueDeclare("email_job_queue", true, false, false, Map.of(
                "x-dead-letter-exchange", "email_job_dlx",
                "x-dead-letter-routing-key", "email_job_queue"));
    }

    @Test
    @DisplayName("getOrCreate - consume and setup channels do not declare anything")
    void testNonPublishChannelsDoNotDeclare() throws Exception {
        // When
        Channel channel = pool.getOrCreate(ChannelKey.consume("email_job_queue"));

        // Then
        verify(channel, never()).queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any());
        verify(channel, never()).confirmSelect();
    }

    @Test
    @DisplayName("getOrCreate - confirms are not enabled when disabled")
    void testConfirmsDisabled() throws Exception {
        // Given
        ChannelPool noConfirms = new ChannelPool(connectionManager, registry, false);

        // When
        Channel channel = noConfirms.getOrCreate(ChannelKey.publish("q"));

        // Then
        verify(channel, never()).confirmSelect();
    }

    @Test
    @DisplayName("getOrCreate - concurrent callers for one key share a single channel")
    void testConcurrentCreationIsAtomic() throws Exception {
        // Given
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Channel>> results = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return pool.getOrCreate(ChannelKey.publish("email_job_queue"));
                }));
            }
            start.countDown();

            Set<Channel> distinct = ConcurrentHashMap.newKeySet();
            for (Future<Channel> result : results) {
                distinct.add(result.get(5, TimeUnit.SECONDS));
            }

            // Then
            assertEquals(1, distinct.size());
            verify(connection, times(1)).createChannel();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("getOrCreate - a channel closed by the broker is evicted and recreated")
    void testEvictsOnShutdown() throws Exception {
        // Given
        ChannelKey key = ChannelKey.consume("email_job_queue");
        Channel first = pool.getOrCreate(key);
        when(first.isOpen()).thenReturn(false);

        // When
        shutdownListenerOf(first).shutdownCompleted(new ShutdownSignalException(false, false, null, first));

        // Then
        assertFalse(pool.contains(key));
        Channel second = pool.getOrCreate(key);
        assertNotSame(first, second);
        assertTrue(pool.contains(key));
    }

    @Test
    @DisplayName("getOrCreate - eviction of one key does not affect other keys")
    void testEvictionIsScoped() throws Exception {
        // Given
        Channel publish = pool.getOrCreate(ChannelKey.publish("a"));
        Channel consume = pool.getOrCreate(ChannelKey.consume("a"));

        // When
        pool.evict(ChannelKey.publish("a"));

        // Then
        verify(publish).close();
        verify(consume, never()).close();
        assertSame(consume, pool.getOrCreate(ChannelKey.consume("a")));
    }

    @Test
    @DisplayName("getOrCreate - a cached channel that is no longer open is replaced")
    void testReplacesClosedChannel() throws Exception {
        // Given
        Channel first = pool.getOrCreate(ChannelKey.setup("q"));
        when(first.isOpen()).thenReturn(false);

        // When
        Channel second = pool.getOrCreate(ChannelKey.setup("q"));

        // Then
        assertNotSame(first, second);
    }

    @Test
    @DisplayName("getOrCreate - fails with ConnectionUnavailable when there is no connection")
    void testNoConnection() {
        // Given
        when(connectionManager.requireConnection())
                .thenThrow(new ConnectionUnavailableException("not connected"));

        // When / Then
        assertThrows(ConnectionUnavailableException.class, () -> pool.getOrCreate(ChannelKey.publish("q")));
        assertEquals(0, pool.size());
    }

    @Test
    @DisplayName("getOrCreate - a failed queue assertion closes the channel and is not cached")
    void testFailedPreparation() throws Exception {
        // Given
        Channel broken = mock(Channel.class);
        when(broken.isOpen()).thenReturn(true);
        when(broken.queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException("PRECONDITION_FAILED"));
        when(connection.createChannel()).thenReturn(broken);

        // When
        ChannelException failure = assertThrows(ChannelException.class,
                () -> pool.getOrCreate(ChannelKey.publish("q")));

        // Then
        assertInstanceOf(IOException.class, failure.getCause());
        verify(broken).close();
        assertFalse(pool.contains(ChannelKey.publish("q")));
    }

    @Test
    @DisplayName("getOrCreate - no free channel number is a ChannelException")
    void testNoChannelAvailable() throws Exception {
        // Given
        when(connection.createChannel()).thenReturn(null);

        // When / Then
        assertThrows(ChannelException.class, () -> pool.getOrCreate(ChannelKey.consume("q")));
    }

    @Test
    @DisplayName("onStateChange - CLOSING closes every channel, RECONNECTING forgets them")
    void testConnectionStateChanges() throws Exception {
        // Given
        Channel a = pool.getOrCreate(ChannelKey.consume("a"));
        Channel b = pool.getOrCreate(ChannelKey.consume("b"));

        // When
        pool.onStateChange(ConnectionState.CONNECTED, ConnectionState.CLOSING, null);

        // Then
        verify(a).close();
        verify(b).close();
        assertEquals(0, pool.size());

        // Given channels on a connection that dies
        Channel c = pool.getOrCreate(ChannelKey.consume("c"));

        // When
        pool.onStateChange(ConnectionState.CONNECTED, ConnectionState.RECONNECTING, null);

        // Then
        assertEquals(0, pool.size());
        verify(c, never()).close();
    }
}
