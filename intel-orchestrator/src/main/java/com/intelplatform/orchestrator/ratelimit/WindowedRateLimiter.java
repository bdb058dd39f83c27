package com.intelplatform.orchestrator.ratelimit;

import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.RateLimitBudget;
import com.intelplatform.orchestrator.registry.ProviderRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calendar-window rate limiter backed by per-{@code providerId:window} bucket maps.
 *
 * <p>Each bucket is updated with {@link ConcurrentHashMap#compute}, so concurrent
 * {@link #recordRequest(String)} calls for the same provider never lose a count.
 * Budgets are read from the {@link ProviderRegistry} at call time.
 */
@Component
public class WindowedRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(WindowedRateLimiter.class);

    static final Duration STALE_BUCKET_AGE = Duration.ofHours(24);

    private final ProviderRegistry registry;
    private final Clock clock;
    private final long sweepIntervalMs;

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, RateLimitState>> windows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> admissionLocks = new ConcurrentHashMap<>();

    private Disposable sweeper;

    public WindowedRateLimiter(ProviderRegistry registry, Clock clock,
                               @Value("${intel.rate-limiter.sweep-interval-ms:300000}") long sweepIntervalMs) {
        this.registry = registry;
        this.clock = clock;
        this.sweepIntervalMs = sweepIntervalMs;
    }

    @PostConstruct
    public void start() {
        Duration interval = Duration.ofMillis(sweepIntervalMs);
        sweeper = Flux.interval(interval, interval)
            .onBackpressureDrop()
            .subscribe(tick -> sweep());
    }

    @PreDestroy
    public void stop() {
        if (sweeper != null) {
            sweeper.dispose();
        }
    }

    @Override
    public boolean checkLimit(String providerId) {
        RateLimitBudget budget = budgetOf(providerId);
        if (budget == null) return false;
        ZonedDateTime now = ZonedDateTime.now(clock);
        for (RateWindow window : RateWindow.values()) {
            if (requestsIn(providerId, window, now) >= window.limit(budget)) {
                log.debug("RATE_LIMIT_REACHED provider={} window={}", providerId, window);
                return false;
            }
        }
        return true;
    }

    @Override
    public void recordRequest(String providerId) {
        RateLimitBudget budget = budgetOf(providerId);
        ZonedDateTime now = ZonedDateTime.now(clock);
        for (RateWindow window : RateWindow.values()) {
            int limit = budget == null ? 0 : window.limit(budget);
            Instant resetTime = window.windowEnd(now).toInstant();
            bucketsOf(providerId, window).compute(window.bucketKey(now), (key, state) ->
                (state == null ? RateLimitState.open(resetTime, limit) : state).increment());
        }
    }

    /** Admissions for one provider are serialized on a per-provider monitor. */
    @Override
    public boolean tryAcquire(String providerId) {
        synchronized (admissionLocks.computeIfAbsent(providerId, k -> new Object())) {
            if (!checkLimit(providerId)) {
                return false;
            }
            recordRequest(providerId);
            return true;
        }
    }

    @Override
    public int getRemainingRequests(String providerId) {
        RateLimitBudget budget = budgetOf(providerId);
        if (budget == null) return 0;
        ZonedDateTime now = ZonedDateTime.now(clock);
        int remaining = Integer.MAX_VALUE;
        for (RateWindow window : RateWindow.values()) {
            remaining = Math.min(remaining, Math.max(0, window.limit(budget) - requestsIn(providerId, window, now)));
        }
        return remaining;
    }

    @Override
    public Instant getResetTime(String providerId) {
        RateLimitBudget budget = budgetOf(providerId);
        ZonedDateTime now = ZonedDateTime.now(clock);
        Instant latest = null;
        if (budget != null) {
            for (RateWindow window : RateWindow.values()) {
                if (requestsIn(providerId, window, now) >= window.limit(budget)) {
                    Instant reset = window.windowEnd(now).toInstant();
                    if (latest == null || reset.isAfter(latest)) latest = reset;
                }
            }
        }
        return latest == null ? now.toInstant() : latest;
    }

    /** Current-bucket state of every window for each registered provider. */
    public Map<String, Map<RateWindow, RateLimitState>> getStatus() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Map<String, Map<RateWindow, RateLimitState>> status = new LinkedHashMap<>();
        for (ProviderConfig provider : registry.getAllProviders()) {
            Map<RateWindow, RateLimitState> perWindow = new EnumMap<>(RateWindow.class);
            for (RateWindow window : RateWindow.values()) {
                int limit = provider.rateLimit() == null ? 0 : window.limit(provider.rateLimit());
                RateLimitState state = currentState(provider.id(), window, now);
                perWindow.put(window, state != null ? state
                    : RateLimitState.open(window.windowEnd(now).toInstant(), limit));
            }
            status.put(provider.id(), perWindow);
        }
        return status;
    }

    /** Clears the counters of one provider, or of every provider when {@code providerId} is null. */
    public void reset(String providerId) {
        if (providerId == null) {
            windows.clear();
        } else {
            for (RateWindow window : RateWindow.values()) {
                windows.remove(windowKey(providerId, window));
            }
        }
        log.info("RATE_LIMIT_RESET provider={}", providerId == null ? "all" : providerId);
    }

    /** Drops buckets whose reset time passed more than 24 hours ago. */
    public int sweep() {
        Instant cutoff = clock.instant().minus(STALE_BUCKET_AGE);
        int removed = 0;
        for (Map.Entry<String, ConcurrentHashMap<String, RateLimitState>> entry : windows.entrySet()) {
            ConcurrentHashMap<String, RateLimitState> buckets = entry.getValue();
            int before = buckets.size();
            buckets.values().removeIf(state -> state.resetTime().isBefore(cutoff));
            removed += before - buckets.size();
            if (buckets.isEmpty()) {
                windows.remove(entry.getKey(), buckets);
            }
        }
        if (removed > 0) {
            log.debug("RATE_LIMIT_SWEEP removedBuckets={}", removed);
        }
        return removed;
    }

    private int requestsIn(String providerId, RateWindow window, ZonedDateTime now) {
        RateLimitState state = currentState(providerId, window, now);
        return state == null ? 0 : state.requests();
    }

    private RateLimitState currentState(String providerId, RateWindow window, ZonedDateTime now) {
        ConcurrentHashMap<String, RateLimitState> buckets = windows.get(windowKey(providerId, window));
        return buckets == null ? null : buckets.get(window.bucketKey(now));
    }

    private ConcurrentHashMap<String, RateLimitState> bucketsOf(String providerId, RateWindow window) {
        return windows.computeIfAbsent(windowKey(providerId, window), k -> new ConcurrentHashMap<>());
    }

    private RateLimitBudget budgetOf(String providerId) {
        ProviderConfig provider = registry.getProvider(providerId);
        return provider == null ? null : provider.rateLimit();
    }

    private static String windowKey(String providerId, RateWindow window) {
        return providerId + ":" + window.name().toLowerCase();
    }
}
