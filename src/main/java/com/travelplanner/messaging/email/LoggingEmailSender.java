package com.travelplanner.messaging.email;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link EmailSender} that only logs. Used when the application provides no mail transport.
 */
@Slf4j
public class LoggingEmailSender implements EmailSender {

    @Override
    public void sendVerificationEmail(String to, String token, String fullName) {
        log.info("[mail] verification email → to={} fullName={}", to, fullName);
    }

    @Override
    public void sendWelcomeEmail(String to, String fullName) {
        log.info("[mail] welcome email → to={} fullName={}", to, fullName);
    }

    @Override
    public void sendPasswordResetEmail(String to, String token) {
        log.info("[mail] password reset email → to={}", to);
    }
}
