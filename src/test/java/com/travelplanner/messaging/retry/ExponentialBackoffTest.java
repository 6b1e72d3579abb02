package com.travelplanner.messaging.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExponentialBackoff - delay computation")
class ExponentialBackoffTest {

    @Test
    @DisplayName("delayFor - should double the initial delay per attempt")
    void testDoublesPerAttempt() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(100), Duration.ofSeconds(30), Duration.ZERO, bound -> 0);

        assertEquals(Duration.ofMillis(100), backoff.delayFor(0));
        assertEquals(Duration.ofMillis(200), backoff.delayFor(1));
        assertEquals(Duration.ofMillis(400), backoff.delayFor(2));
        assertEquals(Duration.ofMillis(800), backoff.delayFor(3));
    }

    @Test
    @DisplayName("delayFor - should cap the exponential part at maxDelay")
    void testCapsAtMaxDelay() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ZERO, bound -> 0);

        assertEquals(Duration.ofSeconds(4), backoff.delayFor(2));
        assertEquals(Duration.ofSeconds(5), backoff.delayFor(3));
        assertEquals(Duration.ofSeconds(5), backoff.delayFor(40));
    }

    @Test
    @DisplayName("delayFor - should add jitter on top of the capped delay")
    void testAddsJitter() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofMillis(250), bound -> bound - 1);

        assertEquals(Duration.ofMillis(2249), backoff.delayFor(5));
    }

    @Test
    @DisplayName("delayFor - random jitter stays below maxJitter")
    void testRandomJitterBounds() {
        ExponentialBackoff backoff = new ExponentialBackoff(
                Duration.ofMillis(100), Duration.ofMillis(100), Duration.ofMillis(50));

        for (int i = 0; i < 200; i++) {
            long millis = backoff.delayFor(3).toMillis();
            assertTrue(millis >= 100 && millis < 150, "delay out of range: " + millis);
        }
    }

    @Test
    @DisplayName("uncapped - should be exactly base * 2^attempt")
    void testUncapped() {
        ExponentialBackoff backoff = ExponentialBackoff.uncapped(Duration.ofSeconds(1));

        assertEquals(Duration.ofSeconds(1), backoff.delayFor(0));
        assertEquals(Duration.ofSeconds(2), backoff.delayFor(1));
        assertEquals(Duration.ofSeconds(4), backoff.delayFor(2));
        assertEquals(Duration.ofSeconds(1024), backoff.delayFor(10));
    }

    @Test
    @DisplayName("scale - should saturate instead of overflowing")
    void testScaleSaturates() {
        assertEquals(Long.MAX_VALUE, ExponentialBackoff.scale(1000, 62));
        assertEquals(Long.MAX_VALUE, ExponentialBackoff.scale(1000, 200));
        assertEquals(0, ExponentialBackoff.scale(0, 200));
        assertEquals(Long.MAX_VALUE, ExponentialBackoff.uncapped(Duration.ofSeconds(1)).delayFor(100).toMillis());
    }

    @Test
    @DisplayName("constructor - should reject maxDelay below initialDelay")
    void testRejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExponentialBackoff(Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ZERO));
    }

    @Test
    @DisplayName("delayFor - should reject a negative attempt")
    void testRejectsNegativeAttempt() {
        ExponentialBackoff backoff = ExponentialBackoff.uncapped(Duration.ofMillis(10));

        assertThrows(IllegalArgumentException.class, () -> backoff.delayFor(-1));
    }
}
