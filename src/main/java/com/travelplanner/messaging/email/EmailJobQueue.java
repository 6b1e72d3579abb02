package com.travelplanner.messaging.email;

import com.travelplanner.messaging.rabbitmq.JobPublisher;
import com.travelplanner.messaging.rabbitmq.JobQueueNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Producer side of the email job family.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailJobQueue {

    public static final String DOMAIN = "email";
    public static final String QUEUE = JobQueueNames.queue(DOMAIN);

    private final JobPublisher publisher;

    /**
     * Enqueues {@code job}. Never throws; a failure is logged and reported as {@code false}.
     */
    public boolean enqueue(EmailJob job) {
        try {
            boolean published = publisher.publish(QUEUE, job);
            if (!published) {
                log.error("Failed to enqueue email job type={} to={}", job.getType().getWireName(), job.getTo());
            }
            return published;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue email job {}", job, e);
            return false;
        }
    }
}
