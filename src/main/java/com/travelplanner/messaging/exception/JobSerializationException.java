package com.travelplanner.messaging.exception;

/**
 * A job body that cannot be encoded, decoded or validated. Permanent: such deliveries are
 * dead-lettered immediately and never retried.
 */
public class JobSerializationException extends MessagingException {

    public JobSerializationException(String message) {
        super(message);
    }

    public JobSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
