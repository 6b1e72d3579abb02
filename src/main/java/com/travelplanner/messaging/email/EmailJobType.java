package com.travelplanner.messaging.email;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Discriminator values of the email job family, as carried in the {@code type} field.
 */
@Getter
@RequiredArgsConstructor
public enum EmailJobType {

    EMAIL_VERIFICATION(EmailJobType.EMAIL_VERIFICATION_NAME),
    WELCOME_EMAIL(EmailJobType.WELCOME_EMAIL_NAME),
    PASSWORD_RESET(EmailJobType.PASSWORD_RESET_NAME);

    public static final String EMAIL_VERIFICATION_NAME = "email_verification";
    public static final String WELCOME_EMAIL_NAME = "welcome_email";
    public static final String PASSWORD_RESET_NAME = "password_reset";

    private final String wireName;
}
