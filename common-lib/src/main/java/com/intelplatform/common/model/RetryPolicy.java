package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Per-provider retry policy. A call is attempted at most {@code maxRetries + 1} times.
 */
public record RetryPolicy(
    @JsonProperty("maxRetries") int maxRetries,
    @JsonProperty("backoffMs") long backoffMs,
    @JsonProperty("exponential") boolean exponential
) {
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before the attempt that follows {@code attempt} (zero-based):
     * {@code backoffMs * 2^attempt} when exponential, otherwise a constant {@code backoffMs}.
     */
    public Duration backoffAfter(int attempt) {
        long delay = exponential ? backoffMs * (1L << attempt) : backoffMs;
        return Duration.ofMillis(delay);
    }
}
