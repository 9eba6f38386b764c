package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry policy for failed stage attempts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Maximum number of attempts, the first one included
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 2000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Whether another attempt may follow the given (1-based) failed attempt
     */
    public boolean hasAttemptsRemaining(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * Delay to wait after the given (1-based) failed attempt: 2s, 4s, 8s ... capped
     */
    public Duration backoffAfter(int failedAttempt) {
        int exponent = Math.max(0, failedAttempt - 1);
        long backoff = (long) (initialIntervalMs * Math.pow(backoffMultiplier, exponent));
        return Duration.ofMillis(Math.min(backoff, maxIntervalMs));
    }
}
