package com.travelplanner.messaging.email;

import com.travelplanner.messaging.JobHandler;
import com.travelplanner.messaging.annotation.JobListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends the e-mail described by an {@link EmailJob}. Delivery failures propagate so the
 * surrounding retry can republish the job.
 */
@Slf4j
@RequiredArgsConstructor
@JobListener(domain = EmailJobQueue.DOMAIN, type = EmailJob.class, description = "Transactional e-mails")
public class EmailJobHandler implements JobHandler<EmailJob> {

    private final EmailSender emailSender;

    @Override
    public boolean handle(EmailJob job) throws Exception {
        int attempt = (job.getRetryCount() != null ? job.getRetryCount() : 0) + 1;
        log.info("Processing email job of type {} for {}. Attempt {}", job.getType().getWireName(), job.getTo(), attempt);

        try {
            if (job instanceof EmailVerificationJob verification) {
                emailSender.sendVerificationEmail(verification.getTo(), verification.getToken(), verification.getFullName());
            } else if (job instanceof WelcomeEmailJob welcome) {
                emailSender.sendWelcomeEmail(welcome.getTo(), welcome.getFullName());
            } else if (job instanceof PasswordResetJob reset) {
                emailSender.sendPasswordResetEmail(reset.getTo(), reset.getToken());
            } else {
                throw new IllegalArgumentException("Unknown email type: " + job.getClass().getName());
            }
        } catch (Exception e) {
            log.error("Failed to send email for {} (type={} attempt={})",
                    job.getTo(), job.getType().getWireName(), attempt, e);
            throw e;
        }

        log.info("Email job for {} processed successfully.", job.getTo());
        return true;
    }
}
