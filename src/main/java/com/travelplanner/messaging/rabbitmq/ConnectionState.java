package com.travelplanner.messaging.rabbitmq;

/**
 * Lifecycle of the single broker connection owned by {@link ConnectionManager}.
 *
 * <pre>
 * DISCONNECTED -(connect)-> CONNECTING -(success)-> CONNECTED
 * CONNECTED -(unexpected loss)-> RECONNECTING -(attempt)-> CONNECTING -> ...
 * CONNECTING/RECONNECTING -(attempts exhausted)-> FAILED
 * any -(close)-> CLOSING -> DISCONNECTED (terminal after close)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CLOSING,
    /** Retry budget exhausted. Every later operation fails fast. */
    FAILED
}
