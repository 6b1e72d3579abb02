package com.travelplanner.messaging.rabbitmq;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Purpose key of a pooled channel: one channel per {role, queue} pair.
 *
 * <p>Rendered as {@code publish:<queue>}, {@code consume:<queue>} or {@code setup:<queue>}.
 */
@Getter
@EqualsAndHashCode
public final class ChannelKey {

    public enum Role {
        SETUP("setup"),
        PUBLISH("publish"),
        CONSUME("consume");

        private final String prefix;

        Role(String prefix) {
            this.prefix = prefix;
        }
    }

    private final Role role;
    private final String queue;

    private ChannelKey(Role role, String queue) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
    }

    public static ChannelKey setup(String queue) {
        return new ChannelKey(Role.SETUP, queue);
    }

    public static ChannelKey publish(String queue) {
        return new ChannelKey(Role.PUBLISH, queue);
    }

    public static ChannelKey consume(String queue) {
        return new ChannelKey(Role.CONSUME, queue);
    }

    @Override
    public String toString() {
        return role.prefix + ":" + queue;
    }
}
