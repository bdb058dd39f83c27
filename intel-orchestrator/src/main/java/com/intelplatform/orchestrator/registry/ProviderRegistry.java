package com.intelplatform.orchestrator.registry;

import com.intelplatform.common.model.HealthStatus;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.ProviderMetrics;
import com.intelplatform.common.model.ProviderResponse;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.orchestrator.provider.ProviderClient;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns provider descriptors, their live metrics and the periodic health probes.
 *
 * <p>Metrics are immutable snapshots swapped per provider id with
 * {@link ConcurrentHashMap#computeIfPresent}, so concurrent outcome reports never lose
 * an update. Registration order is kept and drives provider order in plans.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    static final Duration DEGRADED_PROBE_LATENCY = Duration.ofSeconds(5);

    private final ProviderClient providerClient;
    private final Clock clock;
    private final boolean healthChecksEnabled;
    private final boolean registerDefaults;

    private final ConcurrentHashMap<String, ProviderConfig> providers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ProviderMetrics> metrics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Disposable> healthChecks = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    private volatile boolean probing;

    /** Bare registry: no default providers, probes only run once {@link #startHealthChecks()} is called. */
    public ProviderRegistry(ProviderClient providerClient, Clock clock) {
        this(providerClient, clock, false, false);
    }

    @Autowired
    public ProviderRegistry(ProviderClient providerClient,
                            Clock clock,
                            @Value("${intel.health-check.enabled:true}") boolean healthChecksEnabled,
                            @Value("${intel.providers.register-defaults:true}") boolean registerDefaults) {
        this.providerClient = providerClient;
        this.clock = clock;
        this.healthChecksEnabled = healthChecksEnabled;
        this.registerDefaults = registerDefaults;
    }

    @PostConstruct
    public void init() {
        if (registerDefaults) {
            DefaultProviderCatalog.providers().forEach(this::register);
        }
        if (healthChecksEnabled) {
            startHealthChecks();
        }
        log.info("PROVIDER_REGISTRY_READY providers={} healthChecks={}", registrationOrder.size(), healthChecksEnabled);
    }

    /**
     * Upserts a provider. Metrics restart from a healthy zero state and the probe timer
     * is (re)started when probing is active.
     */
    public void register(ProviderConfig config) {
        Objects.requireNonNull(config, "config");
        providers.put(config.id(), config);
        metrics.put(config.id(), ProviderMetrics.initial(config.id()));
        if (!registrationOrder.contains(config.id())) {
            registrationOrder.add(config.id());
        }
        if (probing) {
            scheduleHealthCheck(config);
        }
        log.info("PROVIDER_REGISTERED provider={} types={}", config.id(), config.types());
    }

    public ProviderConfig getProvider(String providerId) {
        return providers.get(providerId);
    }

    public List<ProviderConfig> getAllProviders() {
        return registrationOrder.stream()
            .map(providers::get)
            .filter(Objects::nonNull)
            .toList();
    }

    public List<ProviderConfig> getProvidersByType(ProviderType type) {
        return getAllProviders().stream()
            .filter(p -> p.supports(type))
            .toList();
    }

    /**
     * Providers serving any requested type whose health is HEALTHY or DEGRADED,
     * deduplicated by id, in registration order.
     */
    public List<ProviderConfig> getHealthyProviders(IntelRequest request) {
        if (request.providers() == null) return List.of();
        Map<String, ProviderConfig> selected = new LinkedHashMap<>();
        for (ProviderType type : request.providers()) {
            for (ProviderConfig provider : getProvidersByType(type)) {
                if (isHealthy(provider.id())) {
                    selected.putIfAbsent(provider.id(), provider);
                }
            }
        }
        return new ArrayList<>(selected.values());
    }

    public boolean isHealthy(String providerId) {
        ProviderMetrics current = metrics.get(providerId);
        return current != null && current.healthStatus().isUsable();
    }

    public ProviderMetrics getMetrics(String providerId) {
        return metrics.get(providerId);
    }

    public List<ProviderMetrics> getAllMetrics() {
        return registrationOrder.stream()
            .map(metrics::get)
            .filter(Objects::nonNull)
            .toList();
    }

    /** Folds one attempt outcome into the provider's metrics; unknown ids are ignored. */
    public void updateMetrics(String providerId, ProviderResponse response) {
        ProviderMetrics previous = metrics.get(providerId);
        ProviderMetrics updated = metrics.computeIfPresent(providerId, (id, m) -> m.record(response));
        logTransition(providerId, previous, updated);
    }

    public void recordRateLimit(String providerId) {
        ProviderMetrics previous = metrics.get(providerId);
        ProviderMetrics updated = metrics.computeIfPresent(providerId, (id, m) -> m.withRateLimitHit());
        log.warn("PROVIDER_RATE_LIMITED provider={} hits={}", providerId,
                 updated == null ? 0 : updated.rateLimitHits());
        logTransition(providerId, previous, updated);
    }

    public void updateHealthStatus(String providerId, HealthStatus status) {
        ProviderMetrics previous = metrics.get(providerId);
        ProviderMetrics updated = metrics.computeIfPresent(providerId, (id, m) -> m.withHealth(status));
        logTransition(providerId, previous, updated);
    }

    // ── health probes ───────────────────────────────────────────────────────

    public void startHealthChecks() {
        probing = true;
        getAllProviders().forEach(this::scheduleHealthCheck);
    }

    /**
     * Runs one probe: a failed probe marks the provider UNHEALTHY, a slow one DEGRADED,
     * anything else HEALTHY. Never errors.
     */
    public Mono<HealthStatus> performHealthCheck(ProviderConfig provider) {
        return Mono.defer(() -> {
            long start = clock.millis();
            return providerClient.healthCheck(provider)
                .then(Mono.fromSupplier(() -> {
                    Duration latency = Duration.ofMillis(clock.millis() - start);
                    return latency.compareTo(DEGRADED_PROBE_LATENCY) > 0
                        ? HealthStatus.DEGRADED
                        : HealthStatus.HEALTHY;
                }));
        })
        .onErrorResume(e -> {
            log.warn("HEALTH_CHECK_FAILED provider={} reason={}", provider.id(), e.getMessage());
            return Mono.just(HealthStatus.UNHEALTHY);
        })
        .doOnNext(status -> updateHealthStatus(provider.id(), status));
    }

    private void scheduleHealthCheck(ProviderConfig provider) {
        if (provider.healthCheck() == null || provider.healthCheck().intervalMs() <= 0) return;
        Duration interval = Duration.ofMillis(provider.healthCheck().intervalMs());
        Disposable probe = Flux.interval(interval, interval)
            .onBackpressureDrop()
            .concatMap(tick -> performHealthCheck(provider))
            .subscribe(
                status -> log.debug("HEALTH_CHECK provider={} status={}", provider.id(), status),
                e -> log.error("HEALTH_CHECK_LOOP_TERMINATED provider={} reason={}", provider.id(), e.getMessage())
            );
        Disposable previous = healthChecks.put(provider.id(), probe);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void logTransition(String providerId, ProviderMetrics previous, ProviderMetrics updated) {
        if (previous != null && updated != null && previous.healthStatus() != updated.healthStatus()) {
            log.info("PROVIDER_HEALTH_CHANGED provider={} from={} to={}",
                     providerId, previous.healthStatus(), updated.healthStatus());
        }
    }

    /** Stops every probe timer. */
    @PreDestroy
    public void destroy() {
        probing = false;
        healthChecks.values().forEach(Disposable::dispose);
        healthChecks.clear();
        log.info("PROVIDER_REGISTRY_STOPPED");
    }
}
