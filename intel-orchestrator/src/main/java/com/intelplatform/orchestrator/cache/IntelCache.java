package com.intelplatform.orchestrator.cache;

import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.IntelRequests;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.RequestType;
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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cache of normalized results keyed by request fingerprint.
 *
 * <p>TTL depends on the request type, clamped to [5, 30] minutes:
 * <pre>
 *   pricing_intelligence  5 min
 *   keyword_research      20 min
 *   competitor_analysis   25 min
 *   market_analysis       30 min
 * </pre>
 * Expired entries are dropped lazily on read and by a periodic sweep. Above
 * {@code intel.cache.max-entries} the least recently accessed entries are evicted.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; no call blocks.
 */
@Component
public class IntelCache {

    private static final Logger log = LoggerFactory.getLogger(IntelCache.class);

    static final Duration MIN_TTL     = Duration.ofMinutes(5);
    static final Duration MAX_TTL     = Duration.ofMinutes(30);
    static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Clock clock;
    private final int maxEntries;
    private final long sweepIntervalMs;

    private Disposable sweeper;

    public IntelCache(Clock clock,
                      @Value("${intel.cache.max-entries:100}") int maxEntries,
                      @Value("${intel.cache.sweep-interval-ms:300000}") long sweepIntervalMs) {
        this.clock = clock;
        this.maxEntries = maxEntries;
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

    /**
     * Returns the stored result for the request, or {@code null} if absent or expired.
     * An expired entry is removed before reporting the miss.
     */
    public NormalizedResult get(IntelRequest request) {
        String key = IntelRequests.fingerprint(request);
        CacheEntry entry = store.get(key);
        Instant now = clock.instant();
        if (entry == null) {
            misses.incrementAndGet();
            log.debug("CACHE_MISS key={}", key);
            return null;
        }
        if (entry.isExpired(now)) {
            store.remove(key, entry);
            misses.incrementAndGet();
            log.debug("CACHE_EXPIRED key={}", key);
            return null;
        }
        entry.touch(now);
        hits.incrementAndGet();
        log.debug("CACHE_HIT key={} ageMs={}", key, Duration.between(entry.getCreatedAt(), now).toMillis());
        return entry.getResult();
    }

    public boolean has(IntelRequest request) {
        CacheEntry entry = store.get(IntelRequests.fingerprint(request));
        return entry != null && !entry.isExpired(clock.instant());
    }

    public void set(IntelRequest request, NormalizedResult result) {
        String key = IntelRequests.fingerprint(request);
        Instant now = clock.instant();
        Duration ttl = ttlFor(request.type());
        store.put(key, new CacheEntry(result, now, now.plus(ttl), now,
            request.type(), request.target(), request.providers()));
        log.info("CACHE_REFRESH key={} ttlSeconds={}", key, ttl.toSeconds());
        evictOverflow();
    }

    /**
     * Removes every entry for {@code target}, restricted to {@code type} when given.
     *
     * @return number of removed entries
     */
    public int invalidate(String target, RequestType type) {
        int before = store.size();
        store.values().removeIf(entry ->
            entry.getTarget().equals(target) && (type == null || entry.getRequestType() == type));
        int removed = Math.max(0, before - store.size());
        log.info("CACHE_INVALIDATE target={} type={} removed={}", target, type == null ? "all" : type.wireName(), removed);
        return removed;
    }

    public void clear() {
        store.clear();
        hits.set(0);
        misses.set(0);
        log.info("CACHE_CLEARED");
    }

    public CacheStats getStats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long lookups = hitCount + missCount;
        Instant now = clock.instant();
        List<CacheStats.EntryStats> entries = store.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(e -> new CacheStats.EntryStats(
                e.getKey(),
                e.getValue().getRequestType().wireName(),
                e.getValue().getTarget(),
                Duration.between(e.getValue().getCreatedAt(), now).toMillis(),
                Duration.between(e.getValue().getCreatedAt(), e.getValue().getExpiresAt()).toMillis()))
            .toList();
        return new CacheStats(entries.size(), maxEntries, hitCount, missCount,
            lookups == 0 ? 0.0 : (double) hitCount / lookups, entries);
    }

    /** Removes expired entries; returns how many were dropped. */
    public int sweep() {
        Instant now = clock.instant();
        int before = store.size();
        store.values().removeIf(entry -> entry.isExpired(now));
        int removed = Math.max(0, before - store.size());
        if (removed > 0) {
            log.debug("CACHE_SWEEP removed={}", removed);
        }
        return removed;
    }

    static Duration ttlFor(RequestType type) {
        Duration ttl;
        if (type == null) {
            ttl = DEFAULT_TTL;
        } else {
            ttl = switch (type) {
                case PRICING_INTELLIGENCE -> Duration.ofMinutes(5);
                case KEYWORD_RESEARCH     -> Duration.ofMinutes(20);
                case COMPETITOR_ANALYSIS  -> Duration.ofMinutes(25);
                case MARKET_ANALYSIS      -> Duration.ofMinutes(30);
            };
        }
        if (ttl.compareTo(MIN_TTL) < 0) return MIN_TTL;
        if (ttl.compareTo(MAX_TTL) > 0) return MAX_TTL;
        return ttl;
    }

    private void evictOverflow() {
        int overflow = store.size() - maxEntries;
        if (overflow <= 0) return;
        List<Map.Entry<String, CacheEntry>> oldest = store.entrySet().stream()
            .sorted(Comparator.comparing(e -> e.getValue().getLastAccessed()))
            .limit(overflow)
            .toList();
        oldest.forEach(e -> store.remove(e.getKey(), e.getValue()));
        log.info("CACHE_EVICT evicted={} maxEntries={}", oldest.size(), maxEntries);
    }
}
