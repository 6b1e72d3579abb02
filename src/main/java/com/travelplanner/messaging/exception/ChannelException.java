package com.travelplanner.messaging.exception;

/**
 * Failure scoped to a single pooled channel. The channel is evicted and recreated on next use.
 */
public class ChannelException extends MessagingException {

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
