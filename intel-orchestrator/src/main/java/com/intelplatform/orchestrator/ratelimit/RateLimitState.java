package com.intelplatform.orchestrator.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request count of one provider in one window bucket.
 */
public record RateLimitState(
    @JsonProperty("requests") int requests,
    @JsonProperty("resetTime") Instant resetTime,
    @JsonProperty("remaining") int remaining
) {
    static RateLimitState open(Instant resetTime, int limit) {
        return new RateLimitState(0, resetTime, limit);
    }

    RateLimitState increment() {
        return new RateLimitState(requests + 1, resetTime, Math.max(0, remaining - 1));
    }
}
