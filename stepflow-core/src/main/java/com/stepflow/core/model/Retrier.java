package com.stepflow.core.model;

import java.time.Duration;
import java.util.List;

/**
 * A declared Retry rule. Immutable.
 * Optional fields keep {@code null} when undeclared so the definition can be written back
 * unchanged; the {@code effective*} accessors apply the language defaults.
 * 
 * Invariants:
 * - errorEquals is non-empty
 * - intervalSeconds >= 1
 * - maxAttempts >= 0
 * - backoffRate >= 1.0
 * - maxDelaySeconds >= 1
 */
public record Retrier(
    List<String> errorEquals,
    Integer intervalSeconds,
    Integer maxAttempts,
    Double backoffRate,
    Integer maxDelaySeconds
) {
    public static final int DEFAULT_INTERVAL_SECONDS = 1;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_RATE = 2.0;

    public Retrier {
        errorEquals = List.copyOf(errorEquals);
    }

    public int effectiveIntervalSeconds() {
        return intervalSeconds != null ? intervalSeconds : DEFAULT_INTERVAL_SECONDS;
    }

    public int effectiveMaxAttempts() {
        return maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
    }

    public double effectiveBackoffRate() {
        return backoffRate != null ? backoffRate : DEFAULT_BACKOFF_RATE;
    }

    /**
     * Check if this rule applies to the given error.
     */
    public boolean matches(ExecutionError error) {
        return error.matches(errorEquals);
    }

    /**
     * Check if more retries are allowed after the given number of retries already made.
     */
    public boolean hasMoreAttempts(int retriesMade) {
        return retriesMade < effectiveMaxAttempts();
    }

    /**
     * Compute the delay before the given retry.
     * 
     * @param attemptNumber 1-indexed retry number
     * @return intervalSeconds * backoffRate^(attempt - 1), capped at maxDelaySeconds if declared
     */
    public Duration delayForAttempt(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        
        double delayMs = effectiveIntervalSeconds() * 1000.0 *
            Math.pow(effectiveBackoffRate(), attemptNumber - 1);
        
        if (maxDelaySeconds != null) {
            delayMs = Math.min(delayMs, maxDelaySeconds * 1000.0);
        }
        
        return Duration.ofMillis((long) delayMs);
    }

    /**
     * Builder for Retrier.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> errorEquals = List.of(ErrorNames.ALL);
        private Integer intervalSeconds;
        private Integer maxAttempts;
        private Double backoffRate;
        private Integer maxDelaySeconds;

        public Builder errorEquals(String... errorEquals) {
            this.errorEquals = List.of(errorEquals);
            return this;
        }

        public Builder intervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffRate(double backoffRate) {
            this.backoffRate = backoffRate;
            return this;
        }

        public Builder maxDelaySeconds(int maxDelaySeconds) {
            this.maxDelaySeconds = maxDelaySeconds;
            return this;
        }

        public Retrier build() {
            return new Retrier(errorEquals, intervalSeconds, maxAttempts, backoffRate, maxDelaySeconds);
        }
    }
}
