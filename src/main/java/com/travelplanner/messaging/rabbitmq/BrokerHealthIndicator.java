package com.travelplanner.messaging.rabbitmq;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * UP while the broker connection is open, DOWN otherwise.
 */
@RequiredArgsConstructor
public class BrokerHealthIndicator implements HealthIndicator {

    private final ConnectionManager connectionManager;

    @Override
    public Health health() {
        Health.Builder builder = connectionManager.isConnected() ? Health.up() : Health.down();
        builder.withDetail("state", connectionManager.getState().name())
                .withDetail("reconnectAttempts", connectionManager.getReconnectAttempts());

        Throwable lastError = connectionManager.getLastError();
        if (lastError != null) {
            builder.withDetail("lastError", lastError.toString());
        }
        return builder.build();
    }
}
