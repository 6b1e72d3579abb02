package com.travelplanner.messaging.rabbitmq;

import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;
import org.springframework.lang.Nullable;

/**
 * Application event mirroring the observable connection lifecycle: connected, reconnecting,
 * closed and permanently failed.
 */
@Getter
@ToString
public class BrokerConnectionEvent extends ApplicationEvent {

    public enum Type {
        CONNECTED,
        RECONNECTING,
        CLOSED,
        FAILED
    }

    private final Type type;

    @Nullable
    @ToString.Exclude
    private final transient Throwable cause;

    public BrokerConnectionEvent(Object source, Type type, @Nullable Throwable cause) {
        super(source);
        this.type = type;
        this.cause = cause;
    }

    /**
     * Maps a state transition to the public event type, or {@code null} for internal steps
     * such as CONNECTING or CLOSING.
     */
    @Nullable
    public static Type typeFor(ConnectionState current) {
        return switch (current) {
            case CONNECTED -> Type.CONNECTED;
            case RECONNECTING -> Type.RECONNECTING;
            case DISCONNECTED -> Type.CLOSED;
            case FAILED -> Type.FAILED;
            default -> null;
        };
    }
}
