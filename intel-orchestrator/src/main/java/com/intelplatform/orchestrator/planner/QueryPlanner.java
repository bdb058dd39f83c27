package com.intelplatform.orchestrator.planner;

import com.intelplatform.common.exception.NoEligibleProvidersException;
import com.intelplatform.common.exception.RateLimitExceededException;
import com.intelplatform.common.exception.RequestCancelledException;
import com.intelplatform.common.model.Freshness;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.IntelRequests;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.ProviderMetrics;
import com.intelplatform.common.model.ProviderResponse;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.model.RequestType;
import com.intelplatform.common.model.ResponseMetadata;
import com.intelplatform.common.model.RetryPolicy;
import com.intelplatform.common.model.StreamChunk;
import com.intelplatform.common.model.StreamChunk.Progress;
import com.intelplatform.common.normalize.ResultNormalizer;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.trace.TraceContextUtil;
import com.intelplatform.orchestrator.cache.IntelCache;
import com.intelplatform.orchestrator.logger.IntelFlowLogger;
import com.intelplatform.orchestrator.provider.ProviderClient;
import com.intelplatform.orchestrator.ratelimit.RateLimiter;
import com.intelplatform.orchestrator.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Plans and executes intelligence requests.
 *
 * <p><strong>Planning:</strong> healthy providers for the requested types, minus those
 * over their rate budget. The duration estimate is
 * <pre>
 *   avg       = mean(avgResponseTime, 1000 ms when a provider has no history)
 *   estimate  = ceil(avg * n / (n &gt; 1 ? 2 : 1))
 *   parallel  = n &gt; 1 &amp;&amp; estimate &gt; 2000 ms
 * </pre>
 *
 * <p><strong>Execution:</strong> cache short-circuit unless {@code realTime}; otherwise every
 * provider is called (concurrently or in plan order) with its own retry policy. A provider that
 * exhausts its attempts settles as a failed response; it never aborts its siblings. The
 * settled responses are normalized in plan order, cached (unless {@code cacheOnly}) and
 * reported with a terminal {@code complete} chunk.
 */
@Service
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    static final double DEFAULT_RESPONSE_TIME_MS   = 1000.0;
    static final long   PARALLEL_THRESHOLD_MS      = 2000L;
    static final int    MEDIUM_PRIORITY_PROVIDERS  = 3;
    static final RetryPolicy NO_RETRY = new RetryPolicy(0, 0, false);

    private final ProviderRegistry registry;
    private final RateLimiter rateLimiter;
    private final IntelCache cache;
    private final ResultNormalizer normalizer;
    private final ProviderClient providerClient;
    private final IntelFlowLogger flowLogger;
    private final Clock clock;

    private final ConcurrentHashMap<String, CancellationToken> activeRequests = new ConcurrentHashMap<>();

    public QueryPlanner(ProviderRegistry registry,
                        RateLimiter rateLimiter,
                        IntelCache cache,
                        ResultNormalizer normalizer,
                        ProviderClient providerClient,
                        IntelFlowLogger flowLogger,
                        Clock clock) {
        this.registry       = registry;
        this.rateLimiter    = rateLimiter;
        this.cache          = cache;
        this.normalizer     = normalizer;
        this.providerClient = providerClient;
        this.flowLogger     = flowLogger;
        this.clock          = clock;
    }

    /**
     * @throws com.intelplatform.common.exception.InvalidIntelRequestException when required fields are missing
     * @throws NoEligibleProvidersException when no healthy provider within its rate budget serves the request
     */
    public QueryPlan createPlan(IntelRequest request) {
        IntelRequests.validate(request);
        String requestId = newRequestId();
        flowLogger.logWithRequestId(IntelFlowLogger.REQUEST_RECEIVED, requestId,
            "type=" + request.type().wireName() + " target=" + request.target());

        List<ProviderConfig> providers = registry.getHealthyProviders(request).stream()
            .filter(p -> rateLimiter.checkLimit(p.id()))
            .toList();
        if (providers.isEmpty()) {
            throw new NoEligibleProvidersException("No healthy providers available for "
                + request.providers().stream().map(ProviderType::wireName).toList());
        }

        long estimate = estimateDuration(providers);
        QueryPlan plan = new QueryPlan(
            requestId,
            providers,
            estimate,
            cacheStrategyFor(request),
            providers.size() > 1 && estimate > PARALLEL_THRESHOLD_MS,
            priorityFor(request, providers));

        flowLogger.logWithRequestId(IntelFlowLogger.PLAN_CREATED, plan.requestId(),
            "providers=" + plan.providerIds() + " estimatedMs=" + estimate
                + " parallel=" + plan.parallelExecution() + " cache=" + plan.cacheStrategy().wireName()
                + " priority=" + plan.priority().wireName());
        return plan;
    }

    /**
     * Executes {@code plan}, reporting progress through {@code onChunk}. Completes with the
     * merged result, empty when the request was cancelled, or errors on an orchestration
     * failure after reporting it as a terminal error chunk.
     */
    public Mono<NormalizedResult> executePlan(QueryPlan plan, IntelRequest request, Consumer<StreamChunk> onChunk) {
        String requestId = plan.requestId();
        Mono<NormalizedResult> pipeline = Mono.defer(() -> {
            CancellationToken token = new CancellationToken(requestId);
            activeRequests.put(requestId, token);

            if (plan.cacheStrategy() != CacheStrategy.BYPASS_CACHE) {
                NormalizedResult cached = cache.get(request);
                if (cached != null) {
                    flowLogger.logWithRequestId(IntelFlowLogger.CACHE_HIT, requestId);
                    onChunk.accept(StreamChunk.result(null, cached, new Progress(1, 1, "Returning cached results")));
                    return Mono.just(cached);
                }
            }

            int total = plan.providers().size();
            onChunk.accept(StreamChunk.progress(0, total, "Querying " + total + " providers..."));
            flowLogger.logWithRequestId(IntelFlowLogger.PROVIDERS_DISPATCHED, requestId,
                "providers=" + plan.providerIds() + " parallel=" + plan.parallelExecution());

            AtomicInteger settled = new AtomicInteger();
            Function<ProviderConfig, Mono<ProviderResponse>> settle =
                provider -> settle(plan, provider, request, token, onChunk, settled);
            Flux<ProviderResponse> responses = plan.parallelExecution()
                ? Flux.fromIterable(plan.providers()).flatMapSequential(settle, total)
                : Flux.fromIterable(plan.providers()).concatMap(settle);

            return responses.collectList().flatMap(results -> {
                if (token.isCancelled()) {
                    flowLogger.logWithRequestId(IntelFlowLogger.REQUEST_CANCELLED, requestId);
                    onChunk.accept(StreamChunk.failure("Request cancelled", StreamChunk.CODE_CANCELLED));
                    return Mono.<NormalizedResult>empty();
                }
                NormalizedResult result = normalizer.normalize(results, request);
                flowLogger.logWithRequestId(IntelFlowLogger.RESULT_NORMALIZED, requestId,
                    "completeness=" + result.metadata().completeness());
                if (plan.cacheStrategy() != CacheStrategy.CACHE_ONLY) {
                    cache.set(request, result.withFreshness(Freshness.CACHED));
                }
                onChunk.accept(StreamChunk.complete(result, total));
                return Mono.just(result);
            });
        })
        .doOnEach(flowLogger.stage(IntelFlowLogger.REQUEST_COMPLETED))
        .onErrorResume(e -> {
            flowLogger.logWithRequestId(IntelFlowLogger.REQUEST_FAILED, requestId, "reason=" + messageOf(e));
            onChunk.accept(StreamChunk.failure(messageOf(e), StreamChunk.CODE_QUERY_FAILED));
            return Mono.error(e);
        })
        .doFinally(signal -> activeRequests.remove(requestId));

        return pipeline.contextWrite(TraceContextUtil.requestId(requestId));
    }

    /**
     * Streaming view of {@link #executePlan}: every chunk in order, then completion. A
     * subscriber that goes away cancels the request.
     */
    public Flux<StreamChunk> stream(QueryPlan plan, IntelRequest request) {
        return Flux.create(sink -> {
            Disposable execution = executePlan(plan, request, sink::next)
                .subscribe(result -> { }, sink::error, sink::complete);
            sink.onCancel(() -> {
                cancelRequest(plan.requestId());
                execution.dispose();
            });
        });
    }

    /**
     * Cancels an in-flight request. Providers already settled stay settled, the rest stop
     * at their next attempt boundary or as soon as their current call is cut short.
     *
     * @return {@code false} when no such request is active
     */
    public boolean cancelRequest(String requestId) {
        CancellationToken token = activeRequests.remove(requestId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("REQUEST_CANCEL_REQUESTED requestId={}", requestId);
        return true;
    }

    public int activeRequestCount() {
        return activeRequests.size();
    }

    // ── per-provider execution ──────────────────────────────────────────────

    private Mono<ProviderResponse> settle(QueryPlan plan, ProviderConfig provider, IntelRequest request,
                                          CancellationToken token, Consumer<StreamChunk> onChunk,
                                          AtomicInteger settled) {
        int total = plan.providers().size();
        return queryProvider(plan.requestId(), provider, request, token)
            .doOnNext(response -> {
                onChunk.accept(StreamChunk.result(provider.id(), response.data(),
                    new Progress(settled.incrementAndGet(), total, "Received data from " + provider.name())));
                flowLogger.logWithRequestId(IntelFlowLogger.PROVIDER_SETTLED, plan.requestId(),
                    "provider=" + provider.id() + " success=true durationMs=" + response.durationMs());
            })
            .onErrorResume(e -> {
                String message = messageOf(e);
                onChunk.accept(StreamChunk.providerError(provider.id(), message, chunkCode(e),
                    new Progress(settled.incrementAndGet(), total, "Failed to get data from " + provider.name())));
                flowLogger.logWithRequestId(IntelFlowLogger.PROVIDER_SETTLED, plan.requestId(),
                    "provider=" + provider.id() + " success=false reason=" + message);
                return Mono.just(ProviderResponse.failure(provider.id(), message,
                    ResponseMetadata.of(plan.requestId(), clock.millis(), 0)));
            });
    }

    /**
     * Calls one provider with its retry policy. Succeeds with the first successful attempt
     * or errors with the last attempt's error.
     */
    Mono<ProviderResponse> queryProvider(String requestId, ProviderConfig provider, IntelRequest request,
                                         CancellationToken token) {
        return Mono.defer(() -> {
            long startedAt = clock.millis();
            return attempt(requestId, provider, request, token, 0)
                .map(payload -> {
                    long now = clock.millis();
                    return ProviderResponse.success(provider.id(), payload,
                        ResponseMetadata.of(requestId, now, now - startedAt));
                });
        });
    }

    private Mono<IntelPayload> attempt(String requestId, ProviderConfig provider, IntelRequest request,
                                       CancellationToken token, int attempt) {
        RetryPolicy retry = provider.retryConfig() != null ? provider.retryConfig() : NO_RETRY;
        return Mono.defer(() -> {
            if (token.isCancelled()) {
                return Mono.<IntelPayload>error(new RequestCancelledException(requestId));
            }
            if (!rateLimiter.tryAcquire(provider.id())) {
                RateLimitExceededException rejected = new RateLimitExceededException(provider.id());
                registry.updateMetrics(provider.id(), ProviderResponse.failure(provider.id(), rejected.getMessage(),
                    ResponseMetadata.of(requestId, clock.millis(), 0)));
                // after updateMetrics: the error-rate verdict must not undo the downgrade
                registry.recordRateLimit(provider.id());
                return Mono.<IntelPayload>error(rejected);
            }

            long attemptStart = clock.millis();
            return providerClient.fetch(provider, request)
                .defaultIfEmpty(IntelPayload.empty())
                .takeUntilOther(token.whenCancelled())
                .switchIfEmpty(Mono.error(() -> new RequestCancelledException(requestId)))
                .doOnNext(payload -> registry.updateMetrics(provider.id(), ProviderResponse.success(
                    provider.id(), payload, elapsedSince(requestId, attemptStart))))
                .doOnError(e -> {
                    if (!(e instanceof RequestCancelledException)) {
                        registry.updateMetrics(provider.id(), ProviderResponse.failure(
                            provider.id(), messageOf(e), elapsedSince(requestId, attemptStart)));
                    }
                });
        })
        .onErrorResume(e -> !(e instanceof RequestCancelledException) && attempt < retry.maxRetries(), e -> {
            Duration backoff = retry.backoffAfter(attempt);
            log.warn("PROVIDER_RETRY requestId={} provider={} attempt={}/{} backoffMs={} reason={}",
                     requestId, provider.id(), attempt + 1, retry.maxAttempts(), backoff.toMillis(), messageOf(e));
            return Mono.delay(backoff)
                .takeUntilOther(token.whenCancelled())
                .then(attempt(requestId, provider, request, token, attempt + 1));
        });
    }

    // ── planning helpers ────────────────────────────────────────────────────

    long estimateDuration(List<ProviderConfig> providers) {
        double avg = providers.stream()
            .mapToDouble(p -> {
                ProviderMetrics m = registry.getMetrics(p.id());
                return m == null || m.avgResponseTime() <= 0 ? DEFAULT_RESPONSE_TIME_MS : m.avgResponseTime();
            })
            .average()
            .orElse(DEFAULT_RESPONSE_TIME_MS);
        int n = providers.size();
        return (long) Math.ceil(avg * n / (n > 1 ? 2 : 1));
    }

    static CacheStrategy cacheStrategyFor(IntelRequest request) {
        if (request.options().isRealTime()) return CacheStrategy.BYPASS_CACHE;
        if (request.options().isCacheOnly()) return CacheStrategy.CACHE_ONLY;
        return CacheStrategy.PREFER_CACHE;
    }

    static PlanPriority priorityFor(IntelRequest request, List<ProviderConfig> providers) {
        if (request.type() == RequestType.COMPETITOR_ANALYSIS) return PlanPriority.HIGH;
        if (providers.size() > MEDIUM_PRIORITY_PROVIDERS) return PlanPriority.MEDIUM;
        return PlanPriority.LOW;
    }

    private String newRequestId() {
        return "req_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private ResponseMetadata elapsedSince(String requestId, long start) {
        long now = clock.millis();
        return ResponseMetadata.of(requestId, now, now - start);
    }

    private static String chunkCode(Throwable e) {
        if (e instanceof RateLimitExceededException) return StreamChunk.CODE_RATE_LIMITED;
        if (e instanceof RequestCancelledException) return StreamChunk.CODE_CANCELLED;
        return StreamChunk.CODE_PROVIDER_ERROR;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
