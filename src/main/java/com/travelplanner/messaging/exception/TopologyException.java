package com.travelplanner.messaging.exception;

/**
 * Raised while declaring exchanges, queues or bindings. Not retried; usually fatal to startup.
 */
public class TopologyException extends MessagingException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
