package com.travelplanner.messaging.email;

import org.springframework.lang.Nullable;

/**
 * Mail transport used by {@link EmailJobHandler}. Implementations throw on delivery failure.
 */
public interface EmailSender {

    void sendVerificationEmail(String to, String token, @Nullable String fullName) throws Exception;

    void sendWelcomeEmail(String to, @Nullable String fullName) throws Exception;

    void sendPasswordResetEmail(String to, String token) throws Exception;
}
