package com.acme.chatcore.gateway;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialReconnectPolicyTest {
    private final ReconnectPolicy policy = ReconnectPolicy.exponential(5, Duration.ofMillis(500), Duration.ofSeconds(3));

    @Test
    void shouldReconnectImmediatelyOnFirstAttempt() {
        assertEquals(Duration.ZERO, policy.backoff(1));
    }

    @Test
    void shouldDoubleUpToCap() {
        assertEquals(Duration.ofMillis(500), policy.backoff(2));
        assertEquals(Duration.ofMillis(1_000), policy.backoff(3));
        assertEquals(Duration.ofMillis(2_000), policy.backoff(4));
        assertEquals(Duration.ofSeconds(3), policy.backoff(5));
        assertEquals(Duration.ofSeconds(3), policy.backoff(500));
    }

    @Test
    void shouldStopAfterMaxAttempts() {
        assertTrue(policy.allowReconnect(0, 1));
        assertTrue(policy.allowReconnect(0, 5));
        assertFalse(policy.allowReconnect(0, 6));
    }

    @Test
    void shouldRejectNonPositiveAttemptBudget() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectPolicy.exponential(0, Duration.ofSeconds(1), Duration.ofSeconds(2)));
    }
}
