package com.travelplanner.messaging.rabbitmq;

import org.springframework.lang.Nullable;

/**
 * Receives every state transition of the {@link ConnectionManager}.
 *
 * <p>Callbacks run on the thread that performed the transition and must not block.
 */
@FunctionalInterface
public interface ConnectionStateListener {

    void onStateChange(ConnectionState previous, ConnectionState current, @Nullable Throwable cause);
}
