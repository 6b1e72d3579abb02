package com.travelplanner.messaging.exception;

/**
 * Base type for every failure raised by the messaging layer.
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
