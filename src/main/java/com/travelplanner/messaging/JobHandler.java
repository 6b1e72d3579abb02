package com.travelplanner.messaging;

/**
 * Business logic invoked for each delivered job.
 *
 * <ul>
 *     <li>{@code true} - processed; the delivery is acknowledged</li>
 *     <li>{@code false} - rejected by the business logic; the delivery is dead-lettered</li>
 *     <li>exception - failure; the delivery is dead-lettered (a
 *     {@link com.travelplanner.messaging.retry.RetryCoordinator} may republish a copy first)</li>
 * </ul>
 *
 * @param <T> decoded job type
 */
@FunctionalInterface
public interface JobHandler<T> {

    boolean handle(T job) throws Exception;
}
