package com.travelplanner.messaging.exception;

/**
 * Permanent connection failure. Raised once the connection manager has exhausted its
 * attempts, and for every operation requested after that point.
 */
public class BrokerConnectionException extends MessagingException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
