package com.travelplanner.messaging.email;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("EmailJobHandler - dispatch by email type")
class EmailJobHandlerTest {

    private EmailSender sender;
    private EmailJobHandler handler;

    @BeforeEach
    void setUp() {
        sender = mock(EmailSender.class);
        handler = new EmailJobHandler(sender);
    }

    @Test
    @DisplayName("handle - email_verification should send a verification email")
    void testVerification() throws Exception {
        // When
        boolean result = handler.handle(new EmailVerificationJob("a@example.com", "tok", "Ada"));

        // Then
        assertTrue(result);
        verify(sender).sendVerificationEmail("a@example.com", "tok", "Ada");
        verifyNoMoreInteractions(sender);
    }

    @Test
    @DisplayName("handle - welcome_email should send a welcome email")
    void testWelcome() throws Exception {
        // When
        boolean result = handler.handle(new WelcomeEmailJob("a@example.com", "Ada"));

        // Then
        assertTrue(result);
        verify(sender).sendWelcomeEmail("a@example.com", "Ada");
    }

    @Test
    @DisplayName("handle - password_reset should send a password reset email")
    void testPasswordReset() throws Exception {
        // When
        boolean result = handler.handle(new PasswordResetJob("a@example.com", "reset"));

        // Then
        assertTrue(result);
        verify(sender).sendPasswordResetEmail("a@example.com", "reset");
    }

    @Test
    @DisplayName("handle - a sender failure should propagate unchanged")
    void testSenderFailure() throws Exception {
        // Given
        IllegalStateException smtpDown = new IllegalStateException("SMTP unavailable");
        doThrow(smtpDown).when(sender).sendWelcomeEmail(anyString(), any());
        WelcomeEmailJob job = new WelcomeEmailJob("a@example.com", null);
        job.setRetryCount(2);

        // When
        Exception thrown = assertThrows(Exception.class, () -> handler.handle(job));

        // Then
        assertSame(smtpDown, thrown);
    }
}
