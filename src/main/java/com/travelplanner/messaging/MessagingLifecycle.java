package com.travelplanner.messaging;

import com.travelplanner.messaging.exception.BrokerConnectionException;
import com.travelplanner.messaging.exception.MessagingException;
import com.travelplanner.messaging.internal.JobListenerProcessor;
import com.travelplanner.messaging.rabbitmq.ConnectionManager;
import com.travelplanner.messaging.rabbitmq.ConsumerLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutionException;

/**
 * Connects to the broker and starts job listeners with the application context; drains
 * consumers and closes the connection when it stops.
 *
 * <p>A failed initial connect fails startup.
 */
@Slf4j
@RequiredArgsConstructor
public class MessagingLifecycle implements SmartLifecycle {

    private final ConnectionManager connectionManager;
    private final ConsumerLoop consumerLoop;
    private final JobListenerProcessor listenerProcessor;
    private final MessagingProperties properties;

    private volatile boolean running;

    @Override
    public void start() {
        log.info("Starting messaging layer...");
        try {
            connectionManager.connect().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted while connecting to RabbitMQ", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MessagingException messagingException) {
                throw messagingException;
            }
            throw new BrokerConnectionException("Failed to connect to RabbitMQ", cause);
        }

        listenerProcessor.startListeners();
        running = true;
        log.info("Messaging layer started");
    }

    @Override
    public void stop() {
        running = false;
        log.info("Stopping messaging layer...");

        if (!consumerLoop.shutdown(properties.getConsumer().getDrainTimeout())) {
            log.warn("Closing RabbitMQ connection with handlers still running");
        }
        connectionManager.close(properties.getConnection().getShutdownTimeout());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStartup();
    }
}
