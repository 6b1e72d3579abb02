package com.travelplanner.messaging.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy - retry budget and cadence")
class RetryPolicyTest {

    @Test
    @DisplayName("delayFor - k-th retry waits baseDelay * 2^(k-1)")
    void testDelayForRetries() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(1000));

        assertEquals(Duration.ofMillis(1000), policy.delayFor(1));
        assertEquals(Duration.ofMillis(2000), policy.delayFor(2));
        assertEquals(Duration.ofMillis(4000), policy.delayFor(3));
        assertEquals(Duration.ofMillis(8000), policy.delayFor(4));
    }

    @Test
    @DisplayName("hasBudgetFor - only attempts below maxRetries are retried")
    void testBudget() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));

        assertTrue(policy.hasBudgetFor(1));
        assertTrue(policy.hasBudgetFor(2));
        assertFalse(policy.hasBudgetFor(3));
        assertFalse(policy.hasBudgetFor(4));
    }

    @Test
    @DisplayName("isRetryable - default treats every failure as retryable")
    void testDefaultClassifier() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));

        assertTrue(policy.isRetryable(new IOException("timeout")));
        assertTrue(policy.isRetryable(new IllegalArgumentException("bad")));
    }

    @Test
    @DisplayName("isRetryable - custom classifier is consulted")
    void testCustomClassifier() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), 10,
                failure -> !(failure instanceof IllegalArgumentException));

        assertTrue(policy.isRetryable(new IOException("timeout")));
        assertFalse(policy.isRetryable(new IllegalArgumentException("bad")));
    }

    @Test
    @DisplayName("constructor - should reject non-positive limits")
    void testRejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(1), 0, failure -> true));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(1)).delayFor(0));
    }
}
