package com.intelplatform.orchestrator.ratelimit;

import java.time.Instant;

/**
 * Admission control against each provider's per-minute, per-hour and per-day budgets.
 */
public interface RateLimiter {

    /** {@code true} only if every window is strictly below its budget. Unknown providers are never admitted. */
    boolean checkLimit(String providerId);

    /** Counts one issued request against every window. */
    void recordRequest(String providerId);

    /**
     * {@link #checkLimit} and {@link #recordRequest} as one atomic step: concurrent callers
     * can never push a window past its budget.
     *
     * @return {@code false} when the request was not admitted, nothing is counted then
     */
    boolean tryAcquire(String providerId);

    /** Smallest remaining budget across the windows. */
    int getRemainingRequests(String providerId);

    /** Now, when no window is exhausted; otherwise the latest reset time among exhausted windows. */
    Instant getResetTime(String providerId);
}
