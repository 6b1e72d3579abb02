package com.travelplanner.messaging.rabbitmq;

/**
 * Naming convention for job queues.
 */
public final class JobQueueNames {

    private JobQueueNames() {
    }

    public static String queue(String domain) {
        return domain + "_job_queue";
    }

    public static String deadLetterExchange(String domain) {
        return domain + "_job_dlx";
    }

    public static String deadLetterQueue(String domain) {
        return domain + "_job_dlx_queue";
    }
}
