package com.stepflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetrierTest {

    @Test
    void undeclaredFields_shouldUseLanguageDefaults() {
        Retrier retrier = Retrier.builder().build();

        assertEquals(List.of(ErrorNames.ALL), retrier.errorEquals());
        assertEquals(1, retrier.effectiveIntervalSeconds());
        assertEquals(3, retrier.effectiveMaxAttempts());
        assertEquals(2.0, retrier.effectiveBackoffRate());
        assertNull(retrier.intervalSeconds());
        assertNull(retrier.maxAttempts());
    }

    @Test
    void delayForAttempt_shouldIncreaseExponentially() {
        Retrier retrier = Retrier.builder()
            .errorEquals("Flaky")
            .intervalSeconds(1)
            .backoffRate(2.0)
            .maxAttempts(3)
            .build();

        assertEquals(Duration.ofSeconds(1), retrier.delayForAttempt(1));
        assertEquals(Duration.ofSeconds(2), retrier.delayForAttempt(2));
        assertEquals(Duration.ofSeconds(4), retrier.delayForAttempt(3));
    }

    @Test
    void delayForAttempt_shouldRespectMaxDelay() {
        Retrier retrier = Retrier.builder()
            .intervalSeconds(1)
            .backoffRate(2.0)
            .maxAttempts(10)
            .maxDelaySeconds(10)
            .build();

        // 2^4 = 16s, capped at 10s
        assertEquals(Duration.ofSeconds(10), retrier.delayForAttempt(5));
    }

    @Test
    void delayForAttempt_shouldSupportFractionalBackoff() {
        Retrier retrier = Retrier.builder()
            .intervalSeconds(2)
            .backoffRate(1.5)
            .build();

        assertEquals(Duration.ofMillis(3000), retrier.delayForAttempt(2));
        assertEquals(Duration.ofMillis(4500), retrier.delayForAttempt(3));
    }

    @Test
    void delayForAttempt_withZeroAttempt_shouldThrow() {
        Retrier retrier = Retrier.builder().build();

        assertThrows(IllegalArgumentException.class, () -> retrier.delayForAttempt(0));
    }

    @Test
    void hasMoreAttempts_shouldStopAtMaxAttempts() {
        Retrier retrier = Retrier.builder().maxAttempts(2).build();

        assertTrue(retrier.hasMoreAttempts(0));
        assertTrue(retrier.hasMoreAttempts(1));
        assertFalse(retrier.hasMoreAttempts(2));
    }

    @Test
    void hasMoreAttempts_withZeroMaxAttempts_shouldNeverRetry() {
        Retrier retrier = Retrier.builder().maxAttempts(0).build();

        assertFalse(retrier.hasMoreAttempts(0));
    }

    @Test
    void matches_shouldUseErrorEquals() {
        Retrier retrier = Retrier.builder().errorEquals("Timeout", "Throttled").build();

        assertTrue(retrier.matches(new ExecutionError("Throttled", "slow down")));
        assertFalse(retrier.matches(new ExecutionError("ValidationError", "bad input")));
    }
}
