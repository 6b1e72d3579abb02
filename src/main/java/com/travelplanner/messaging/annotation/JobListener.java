package com.travelplanner.messaging.annotation;

import java.lang.annotation.*;

/**
 * Marks a {@link com.travelplanner.messaging.JobHandler} bean as the consumer of a job family.
 *
 * <p>The queue topology follows the job naming convention:
 * <ul>
 *   <li>main queue → {@code <domain>_job_queue}</li>
 *   <li>dead-letter exchange → {@code <domain>_job_dlx}</li>
 *   <li>dead-letter queue → {@code <domain>_job_dlx_queue}</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @JobListener(domain = "email", type = EmailJob.class)
 * public class EmailJobHandler implements JobHandler<EmailJob> {
 *
 *     @Override
 *     public boolean handle(EmailJob job) {
 *         // send the e-mail...
 *         return true;
 *     }
 * }
 * }
 * </pre>
 *
 * <p>When {@link #type()} implements {@link com.travelplanner.messaging.RetryableJob} the handler
 * is wrapped in a {@link com.travelplanner.messaging.retry.RetryCoordinator} configured from
 * {@code messaging.jobs.<domain>.*}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobListener {

    /**
     * Job family name, e.g. {@code "email"}.
     */
    String domain();

    /**
     * Type the message body is decoded to before the handler is invoked.
     */
    Class<?> type();

    /**
     * Maximum number of unacknowledged deliveries handled at once. A value of 0 uses
     * {@code messaging.jobs.<domain>.concurrency}, then {@code messaging.consumer.default-concurrency}.
     */
    int concurrency() default 0;

    /**
     * Failures that are dead-lettered right away instead of being retried.
     */
    Class<? extends Throwable>[] noRetryFor() default {};

    /**
     * Optional human-readable description of the job family.
     */
    String description() default "";
}
