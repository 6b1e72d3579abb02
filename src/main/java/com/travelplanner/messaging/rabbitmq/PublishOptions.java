package com.travelplanner.messaging.rabbitmq;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Per-publish metadata. Delivery is always persistent regardless of these options.
 */
@Value
@Builder
public class PublishOptions {

    private static final PublishOptions DEFAULTS = PublishOptions.builder().build();

    @Singular
    Map<String, Object> headers;

    /** Message id; a random UUID is generated per message when absent. */
    @Nullable
    String messageId;

    /** Per-message TTL in milliseconds, as the broker expects it. */
    @Nullable
    String expiration;

    public static PublishOptions defaults() {
        return DEFAULTS;
    }
}
