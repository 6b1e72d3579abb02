package com.travelplanner.messaging;

import org.springframework.lang.Nullable;

/**
 * A job that can take part in application-level retry. The attempt counter travels in the
 * body as {@code retryCount}; it is absent on the first delivery.
 */
public interface RetryableJob {

    @Nullable
    Integer getRetryCount();

    /**
     * Key that scheduled retries are counted under when capping the retry backlog.
     */
    default String retryKey() {
        return getClass().getSimpleName();
    }
}
