package com.travelplanner.messaging.exception;

/**
 * The retry copy of a failed job could not be published. The original delivery goes back to
 * its queue instead of the dead-letter queue so the job is not lost.
 */
public class RetryDeferredException extends MessagingException {

    public RetryDeferredException(String message, Throwable cause) {
        super(message, cause);
    }
}
