package com.travelplanner.messaging.email;

import com.travelplanner.messaging.MessagingAutoConfiguration;
import com.travelplanner.messaging.rabbitmq.JobPublisher;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Email job family: producer, consumer and a logging mail transport unless the application
 * provides its own {@link EmailSender}.
 *
 * <pre>
 *   messaging.jobs.email.enabled = false
 * </pre>
 * turns the family off.
 */
@AutoConfiguration(after = MessagingAutoConfiguration.class)
@ConditionalOnBean(JobPublisher.class)
@ConditionalOnProperty(prefix = "messaging.jobs.email", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EmailJobAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EmailSender emailSender() {
        return new LoggingEmailSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailJobHandler emailJobHandler(EmailSender emailSender) {
        return new EmailJobHandler(emailSender);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailJobQueue emailJobQueue(JobPublisher jobPublisher) {
        return new EmailJobQueue(jobPublisher);
    }
}
