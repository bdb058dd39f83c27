package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of one provider's live metrics.
 *
 * <p>Every transition returns a new instance so the owner can swap snapshots atomically
 * per provider id (e.g. inside {@code ConcurrentHashMap.compute}).
 *
 * <p>Health after a call is derived from the cumulative error rate:
 * <pre>
 *   errorRate &gt; 0.5 → UNHEALTHY
 *   errorRate &gt; 0.2 → DEGRADED
 *   otherwise      → HEALTHY
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderMetrics(
    @JsonProperty("providerId") String providerId,
    @JsonProperty("requestCount") long requestCount,
    @JsonProperty("successCount") long successCount,
    @JsonProperty("errorCount") long errorCount,
    @JsonProperty("avgResponseTime") double avgResponseTime,
    @JsonProperty("rateLimitHits") long rateLimitHits,
    @JsonProperty("lastError") String lastError,
    @JsonProperty("healthStatus") HealthStatus healthStatus,
    @JsonProperty("uptime") double uptime
) {
    static final double UNHEALTHY_ERROR_RATE = 0.5;
    static final double DEGRADED_ERROR_RATE  = 0.2;
    static final double MAX_UPTIME           = 100.0;
    static final double UPTIME_GAIN          = 1.0;
    static final double UPTIME_PENALTY       = 5.0;

    public static ProviderMetrics initial(String providerId) {
        return new ProviderMetrics(providerId, 0, 0, 0, 0.0, 0, null, HealthStatus.HEALTHY, MAX_UPTIME);
    }

    /**
     * Folds one call outcome into the counters, the rolling average
     * {@code (avg*(n-1)+duration)/n} and the error-rate health.
     */
    public ProviderMetrics record(ProviderResponse response) {
        long requests = requestCount + 1;
        long successes = successCount + (response.success() ? 1 : 0);
        long errors = errorCount + (response.success() ? 0 : 1);
        String error = response.success() ? lastError : response.error();
        double avg = (avgResponseTime * (requests - 1) + response.durationMs()) / requests;

        double errorRate = (double) errors / requests;
        HealthStatus status;
        if (errorRate > UNHEALTHY_ERROR_RATE) {
            status = HealthStatus.UNHEALTHY;
        } else if (errorRate > DEGRADED_ERROR_RATE) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.HEALTHY;
        }
        return new ProviderMetrics(providerId, requests, successes, errors, avg,
            rateLimitHits, error, status, uptime);
    }

    /** A rate-limit rejection is a health signal on its own: always downgrades to DEGRADED. */
    public ProviderMetrics withRateLimitHit() {
        return new ProviderMetrics(providerId, requestCount, successCount, errorCount,
            avgResponseTime, rateLimitHits + 1, lastError, HealthStatus.DEGRADED, uptime);
    }

    /** Applies a probe verdict; uptime gains 1 (cap 100) on HEALTHY and loses 5 (floor 0) on UNHEALTHY. */
    public ProviderMetrics withHealth(HealthStatus status) {
        double newUptime = uptime;
        if (status == HealthStatus.HEALTHY) {
            newUptime = Math.min(MAX_UPTIME, uptime + UPTIME_GAIN);
        } else if (status == HealthStatus.UNHEALTHY) {
            newUptime = Math.max(0.0, uptime - UPTIME_PENALTY);
        }
        return new ProviderMetrics(providerId, requestCount, successCount, errorCount,
            avgResponseTime, rateLimitHits, lastError, status, newUptime);
    }
}
