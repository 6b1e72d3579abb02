package com.travelplanner.messaging.rabbitmq;

import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.travelplanner.messaging.exception.BrokerConnectionException;
import com.travelplanner.messaging.exception.ConnectionUnavailableException;
import com.travelplanner.messaging.retry.ExponentialBackoff;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single broker connection of the process.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>Initial connect with a bounded number of attempts</li>
 *     <li>Autonomous reconnect after an unexpected loss, using exponential backoff with jitter</li>
 *     <li>Tracking broker flow control (connection blocked / unblocked)</li>
 *     <li>Graceful close with a forced abort fallback</li>
 * </ul>
 *
 * <p>All attempts run on the supplied scheduler. Transient failures never reach callers; only
 * the final give-up is reported, as a {@link BrokerConnectionException}. After {@link #close}
 * the manager never reconnects again.
 */
@Slf4j
public class ConnectionManager {

    private final ConnectionFactory connectionFactory;
    private final ScheduledExecutorService scheduler;
    private final String connectionName;

    private final int initialAttempts;
    private final ExponentialBackoff initialBackoff;
    private final int maxReconnectAttempts;
    private final ExponentialBackoff reconnectBackoff;

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final Object flowMonitor = new Object();

    // guarded by lock
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Connection connection;
    private CompletableFuture<Connection> pending;
    private ScheduledFuture<?> scheduledAttempt;
    private int reconnectAttempts;
    private Throwable lastError;
    private boolean explicitlyClosed;

    // guarded by flowMonitor
    private boolean blocked;

    public ConnectionManager(ConnectionFactory connectionFactory,
                             ScheduledExecutorService scheduler,
                             String connectionName,
                             int initialAttempts,
                             ExponentialBackoff initialBackoff,
                             int maxReconnectAttempts,
                             ExponentialBackoff reconnectBackoff) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.connectionName = connectionName;
        this.initialAttempts = Math.max(1, initialAttempts);
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.maxReconnectAttempts = Math.max(1, maxReconnectAttempts);
        this.reconnectBackoff = Objects.requireNonNull(reconnectBackoff, "reconnectBackoff must not be null");
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // =====================================================================
    // CONNECT
    // =====================================================================

    /**
     * Opens the connection. Idempotent: returns a completed future when already connected and
     * the in-flight future while an attempt sequence is running.
     */
    public CompletableFuture<Connection> connect() {
        ConnectionState previous;
        ConnectionState next;
        CompletableFuture<Connection> result;

        synchronized (lock) {
            if (state == ConnectionState.CONNECTED && connection != null && connection.isOpen()) {
                return CompletableFuture.completedFuture(connection);
            }
            if (pending != null) {
                return pending;
            }
            if (explicitlyClosed) {
                return CompletableFuture.failedFuture(
                        new ConnectionUnavailableException("Connection manager has been closed"));
            }
            if (state == ConnectionState.FAILED) {
                return CompletableFuture.failedFuture(giveUpError());
            }

            previous = state;
            // still CONNECTED here means the connection died before its shutdown listener ran
            next = previous == ConnectionState.CONNECTED ? ConnectionState.RECONNECTING : ConnectionState.CONNECTING;
            state = next;
            reconnectAttempts = 0;
            pending = new CompletableFuture<>();
            result = pending;
        }

        fire(previous, next, null);
        if (next == ConnectionState.RECONNECTING) {
            log.warn("RabbitMQ connection found closed, reconnecting (maxAttempts={})", maxReconnectAttempts);
            scheduler.execute(() -> attempt(0, maxReconnectAttempts, reconnectBackoff, true));
        } else {
            log.info("Connecting to RabbitMQ (name={} maxAttempts={})", connectionName, initialAttempts);
            scheduler.execute(() -> attempt(0, initialAttempts, initialBackoff, false));
        }
        return result;
    }

    private void attempt(int attemptIndex, int maxAttempts, ExponentialBackoff backoff, boolean reconnecting) {
        ConnectionState previous;
        synchronized (lock) {
            scheduledAttempt = null;
            if (explicitlyClosed || pending == null) {
                return;
            }
            previous = state;
            state = ConnectionState.CONNECTING;
        }
        if (previous != ConnectionState.CONNECTING) {
            fire(previous, ConnectionState.CONNECTING, null);
        }

        log.debug("RabbitMQ connection attempt {}/{}", attemptIndex + 1, maxAttempts);

        Connection opened;
        try {
            opened = connectionFactory.newConnection(connectionName);
        } catch (Exception e) {
            onAttemptFailed(attemptIndex, maxAttempts, backoff, reconnecting, e);
            return;
        }
        onAttemptSucceeded(opened);
    }

    private void onAttemptSucceeded(Connection opened) {
        CompletableFuture<Connection> completed;
        ConnectionState previous;

        synchronized (lock) {
            if (explicitlyClosed) {
                log.info("Connection established after close was requested, discarding it");
                opened.abort();
                return;
            }
            opened.addShutdownListener(cause -> onConnectionLost(opened, cause));
            opened.addBlockedListener(new FlowListener());

            connection = opened;
            reconnectAttempts = 0;
            lastError = null;
            previous = state;
            state = ConnectionState.CONNECTED;
            completed = pending;
            pending = null;
        }

        log.info("RabbitMQ connection established (name={})", connectionName);
        fire(previous, ConnectionState.CONNECTED, null);
        if (completed != null) {
            completed.complete(opened);
        }
    }

    private void onAttemptFailed(int attemptIndex,
                                 int maxAttempts,
                                 ExponentialBackoff backoff,
                                 boolean reconnecting,
                                 Exception error) {
        CompletableFuture<Connection> failed = null;
        ConnectionState previous;
        ConnectionState next;
        Duration delay = null;

        synchronized (lock) {
            lastError = error;
            if (explicitlyClosed) {
                return;
            }
            previous = state;
            int attemptsMade = attemptIndex + 1;

            if (attemptsMade >= maxAttempts) {
                state = ConnectionState.FAILED;
                failed = pending;
                pending = null;
            } else {
                delay = backoff.delayFor(attemptIndex);
                reconnectAttempts = attemptsMade;
                state = reconnecting ? ConnectionState.RECONNECTING : ConnectionState.CONNECTING;
                scheduledAttempt = scheduler.schedule(
                        () -> attempt(attemptsMade, maxAttempts, backoff, reconnecting),
                        delay.toMillis(),
                        TimeUnit.MILLISECONDS);
            }
            next = state;
        }

        if (next == ConnectionState.FAILED) {
            log.error("Max RabbitMQ connection attempts ({}) reached. Giving up.", maxAttempts, error);
            fire(previous, next, error);
            if (failed != null) {
                failed.completeExceptionally(giveUpError());
            }
            return;
        }

        log.warn("RabbitMQ connection attempt {}/{} failed, retrying in {}ms: {}",
                attemptIndex + 1, maxAttempts, delay.toMillis(), error.toString());
        if (previous != next) {
            fire(previous, next, error);
        }
    }

    // =====================================================================
    // LOSS & RECONNECT
    // =====================================================================

    private void onConnectionLost(Connection lost, ShutdownSignalException cause) {
        synchronized (flowMonitor) {
            blocked = false;
            flowMonitor.notifyAll();
        }

        ConnectionState previous;
        synchronized (lock) {
            if (connection != lost) {
                return;
            }
            connection = null;
            if (explicitlyClosed) {
                log.info("RabbitMQ connection closed explicitly");
                return;
            }
            lastError = cause;
            previous = state;
            if (pending != null) {
                // connect() saw the closed connection first and is already reconnecting
                log.warn("RabbitMQ connection closed unexpectedly, reconnect already in progress", cause);
                return;
            }
            state = ConnectionState.RECONNECTING;
            reconnectAttempts = 0;
            pending = new CompletableFuture<>();
        }

        log.warn("RabbitMQ connection closed unexpectedly, reconnecting (maxAttempts={})",
                maxReconnectAttempts, cause);
        fire(previous, ConnectionState.RECONNECTING, cause);
        scheduler.execute(() -> attempt(0, maxReconnectAttempts, reconnectBackoff, true));
    }

    // =====================================================================
    // ACCESS
    // =====================================================================

    /**
     * Returns the open connection.
     *
     * @throws BrokerConnectionException       after the manager gave up
     * @throws ConnectionUnavailableException  when no open connection exists right now
     */
    public Connection requireConnection() {
        synchronized (lock) {
            if (state == ConnectionState.FAILED) {
                throw giveUpError();
            }
            if (connection == null || !connection.isOpen()) {
                throw new ConnectionUnavailableException(
                        "RabbitMQ connection not available (state=" + state + ")");
            }
            return connection;
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return state == ConnectionState.CONNECTED && connection != null && connection.isOpen();
        }
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    @Nullable
    public Throwable getLastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    // =====================================================================
    // FLOW CONTROL
    // =====================================================================

    public boolean isBlocked() {
        synchronized (flowMonitor) {
            return blocked;
        }
    }

    /**
     * Waits until the broker lifts flow control on the connection.
     *
     * @return {@code true} if the connection is writable, {@code false} if still blocked at the deadline
     */
    public boolean awaitUnblocked(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (flowMonitor) {
            while (blocked) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(flowMonitor, remaining);
            }
            return true;
        }
    }

    private class FlowListener implements BlockedListener {

        @Override
        public void handleBlocked(String reason) {
            log.warn("RabbitMQ connection blocked by broker: {}", reason);
            synchronized (flowMonitor) {
                blocked = true;
            }
        }

        @Override
        public void handleUnblocked() {
            log.info("RabbitMQ connection unblocked");
            synchronized (flowMonitor) {
                blocked = false;
                flowMonitor.notifyAll();
            }
        }
    }

    // =====================================================================
    // CLOSE
    // =====================================================================

    /**
     * Closes the connection and suppresses any further reconnect. Listeners see CLOSING before
     * the connection goes away so they can close their channels first. If the graceful close
     * does not finish within {@code timeout} the connection is aborted.
     */
    public void close(Duration timeout) {
        Connection toClose;
        CompletableFuture<Connection> abandoned;
        ConnectionState previous;

        synchronized (lock) {
            if (explicitlyClosed) {
                return;
            }
            explicitlyClosed = true;
            if (scheduledAttempt != null) {
                scheduledAttempt.cancel(false);
                scheduledAttempt = null;
            }
            previous = state;
            state = ConnectionState.CLOSING;
            toClose = connection;
            abandoned = pending;
            pending = null;
        }

        log.info("Closing RabbitMQ connection...");
        fire(previous, ConnectionState.CLOSING, null);
        if (abandoned != null) {
            abandoned.completeExceptionally(
                    new ConnectionUnavailableException("Connection manager closed while connecting"));
        }

        if (toClose != null) {
            int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
            try {
                toClose.close(timeoutMs);
                log.info("RabbitMQ connection closed gracefully");
            } catch (IOException | RuntimeException e) {
                log.warn("Graceful RabbitMQ close failed, aborting connection", e);
                toClose.abort(timeoutMs);
            }
        }

        synchronized (lock) {
            connection = null;
            state = ConnectionState.DISCONNECTED;
        }
        fire(ConnectionState.CLOSING, ConnectionState.DISCONNECTED, null);
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private BrokerConnectionException giveUpError() {
        return new BrokerConnectionException(
                "RabbitMQ connection permanently failed; giving up", lastError);
    }

    private void fire(ConnectionState previous, ConnectionState current, @Nullable Throwable cause) {
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, current, cause);
            } catch (RuntimeException e) {
                log.warn("Connection state listener failed ({} -> {})", previous, current, e);
            }
        }
    }
}
