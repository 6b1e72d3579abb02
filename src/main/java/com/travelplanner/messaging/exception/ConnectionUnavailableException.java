package com.travelplanner.messaging.exception;

/**
 * Thrown when a channel is requested while no open broker connection exists.
 */
public class ConnectionUnavailableException extends MessagingException {

    public ConnectionUnavailableException(String message) {
        super(message);
    }
}
