package com.intelplatform.orchestrator.planner;

import com.intelplatform.common.exception.NoEligibleProvidersException;
import com.intelplatform.common.exception.ProviderException;
import com.intelplatform.common.model.ChunkType;
import com.intelplatform.common.model.Freshness;
import com.intelplatform.common.model.HealthStatus;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.ProviderResponse;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.model.RateLimitBudget;
import com.intelplatform.common.model.RequestOptions;
import com.intelplatform.common.model.RequestType;
import com.intelplatform.common.model.ResponseMetadata;
import com.intelplatform.common.model.RetryPolicy;
import com.intelplatform.common.model.StreamChunk;
import com.intelplatform.common.normalize.ResultNormalizer;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.payload.SeoData;
import com.intelplatform.common.payload.TrafficData;
import com.intelplatform.orchestrator.MutableClock;
import com.intelplatform.orchestrator.ScriptedProviderClient;
import com.intelplatform.orchestrator.TestProviders;
import com.intelplatform.orchestrator.cache.IntelCache;
import com.intelplatform.orchestrator.logger.IntelFlowLogger;
import com.intelplatform.orchestrator.ratelimit.WindowedRateLimiter;
import com.intelplatform.orchestrator.registry.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class QueryPlannerTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final IntelPayload SEO = IntelPayload.ofSeo(new SeoData(40, 1_000L, null, null, null));
    private static final IntelPayload TRAFFIC = IntelPayload.ofTraffic(new TrafficData(5_000L, 0.4, null, null, null));

    private MutableClock clock;
    private ScriptedProviderClient client;
    private ProviderRegistry registry;
    private WindowedRateLimiter rateLimiter;
    private IntelCache cache;
    private QueryPlanner planner;

    private final List<StreamChunk> chunks = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        client = new ScriptedProviderClient();
        registry = new ProviderRegistry(client, clock);
        rateLimiter = new WindowedRateLimiter(registry, clock, 300_000);
        cache = new IntelCache(clock, 100, 300_000);
        planner = new QueryPlanner(registry, rateLimiter, cache, new ResultNormalizer(clock),
            client, new IntelFlowLogger(), clock);

        registry.register(TestProviders.provider("ahrefs", ProviderType.SEO));
        registry.register(TestProviders.provider("similarweb", ProviderType.TRAFFIC));
    }

    private static IntelRequest seoAndTraffic() {
        return IntelRequest.of(RequestType.COMPETITOR_ANALYSIS, "acme.com",
            List.of(ProviderType.SEO, ProviderType.TRAFFIC));
    }

    private NormalizedResult run(IntelRequest request) {
        QueryPlan plan = planner.createPlan(request);
        return planner.executePlan(plan, request, chunks::add).block(TIMEOUT);
    }

    // ── planning ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("createPlan()")
    class PlanTests {

        @Test
        @DisplayName("selects healthy providers and skips UNHEALTHY ones")
        void excludesUnhealthy() {
            registry.updateHealthStatus("similarweb", HealthStatus.UNHEALTHY);

            QueryPlan plan = planner.createPlan(seoAndTraffic());

            assertEquals(List.of("ahrefs"), plan.providerIds());
        }

        @Test
        @DisplayName("no eligible provider fails fast without any provider call")
        void noEligibleProviders() {
            IntelRequest request = IntelRequest.of(RequestType.MARKET_ANALYSIS, "acme.com", List.of(ProviderType.REVIEWS));

            assertThrows(NoEligibleProvidersException.class, () -> planner.createPlan(request));
            assertEquals(0, client.totalCalls());
        }

        @Test
        @DisplayName("providers over their rate budget are left out of the plan")
        void rateLimitedProviderExcluded() {
            registry.register(TestProviders.provider("ahrefs", new RateLimitBudget(1, 10, 100),
                TestProviders.NO_RETRY, ProviderType.SEO));
            rateLimiter.recordRequest("ahrefs");

            assertEquals(List.of("similarweb"), planner.createPlan(seoAndTraffic()).providerIds());
        }

        @Test
        @DisplayName("no history: 1000 ms per provider, halved when several run, sequential")
        void defaultEstimate() {
            QueryPlan plan = planner.createPlan(seoAndTraffic());

            assertEquals(1000, plan.estimatedDuration());
            assertFalse(plan.parallelExecution());
            assertEquals(PlanPriority.HIGH, plan.priority());
            assertEquals(CacheStrategy.PREFER_CACHE, plan.cacheStrategy());
            assertTrue(plan.requestId().startsWith("req_"));
        }

        @Test
        @DisplayName("slow providers push the estimate above 2 s and switch to parallel execution")
        void slowProvidersRunInParallel() {
            ResponseMetadata slow = ResponseMetadata.of("r", 0, 2_500);
            registry.updateMetrics("ahrefs", ProviderResponse.success("ahrefs", SEO, slow));
            registry.updateMetrics("similarweb", ProviderResponse.success("similarweb", TRAFFIC, slow));

            QueryPlan plan = planner.createPlan(seoAndTraffic());

            assertEquals(2500, plan.estimatedDuration());
            assertTrue(plan.parallelExecution());
        }

        @Test
        @DisplayName("realTime bypasses the cache, cacheOnly suppresses the write, more than 3 providers is MEDIUM")
        void strategyAndPriority() {
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));

            assertEquals(CacheStrategy.BYPASS_CACHE,
                QueryPlanner.cacheStrategyFor(request.withOptions(new RequestOptions(true, null, null, null))));
            assertEquals(CacheStrategy.CACHE_ONLY,
                QueryPlanner.cacheStrategyFor(request.withOptions(new RequestOptions(null, true, null, null))));
            assertEquals(PlanPriority.LOW, QueryPlanner.priorityFor(request, List.of()));
            assertEquals(PlanPriority.MEDIUM, QueryPlanner.priorityFor(request, List.of(
                TestProviders.provider("a", ProviderType.SEO), TestProviders.provider("b", ProviderType.SEO),
                TestProviders.provider("c", ProviderType.SEO), TestProviders.provider("d", ProviderType.SEO))));
        }
    }

    // ── execution ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("executePlan()")
    class ExecuteTests {

        @Test
        @DisplayName("two healthy providers: full completeness, progress first, complete last")
        void endToEnd() {
            client.answer("ahrefs", SEO).answer("similarweb", TRAFFIC);

            NormalizedResult result = run(seoAndTraffic());

            assertEquals(1.0, result.metadata().completeness());
            assertEquals(40, result.data().seo().domainAuthority());
            assertEquals(5_000L, result.data().traffic().monthlyVisits());
            assertEquals(Freshness.FRESH, result.metadata().freshness());

            assertEquals(List.of(ChunkType.PROGRESS, ChunkType.RESULT, ChunkType.RESULT, ChunkType.COMPLETE),
                chunks.stream().map(StreamChunk::type).toList());
            assertEquals(2, chunks.get(0).progress().total());
            assertEquals(0, chunks.get(0).progress().completed());
            assertEquals(2, chunks.get(3).progress().completed());
            assertSame(result, chunks.get(3).data());
        }

        @Test
        @DisplayName("a failing provider is reported but does not abort its sibling")
        void failureIsolation() {
            client.script("ahrefs", attempt -> Mono.error(new ProviderException("ahrefs", "HTTP 503")))
                  .answer("similarweb", TRAFFIC);

            NormalizedResult result = run(seoAndTraffic());

            assertEquals(0.5, result.metadata().completeness());
            assertNull(result.data().seo());
            StreamChunk error = chunks.stream().filter(c -> c.type() == ChunkType.ERROR).findFirst().orElseThrow();
            assertEquals("ahrefs", error.providerId());
            assertEquals(StreamChunk.CODE_PROVIDER_ERROR, error.error().code());
            assertEquals("[ahrefs] HTTP 503", error.error().message());
            assertEquals(ChunkType.COMPLETE, chunks.get(chunks.size() - 1).type());
        }

        @Test
        @DisplayName("always failing with maxRetries=2: 3 calls spaced ~100 ms then ~200 ms, provider-level failure")
        void retryWithBackoff() {
            registry.register(TestProviders.provider("ahrefs", TestProviders.GENEROUS,
                new RetryPolicy(2, 100, true), ProviderType.SEO));
            client.script("ahrefs", attempt -> Mono.error(new ProviderException("ahrefs", "HTTP 502")));
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));

            NormalizedResult result = run(request);

            assertNotNull(result);
            assertEquals(0.0, result.metadata().completeness());
            assertTrue(result.data().isEmpty());
            List<Long> calls = client.callTimesNanos("ahrefs");
            assertEquals(3, calls.size());
            assertTrue(Duration.ofNanos(calls.get(1) - calls.get(0)).toMillis() >= 95);
            assertTrue(Duration.ofNanos(calls.get(2) - calls.get(1)).toMillis() >= 195);
            assertEquals(3, registry.getMetrics("ahrefs").errorCount());
            assertEquals(ChunkType.COMPLETE, chunks.get(chunks.size() - 1).type());
        }

        @Test
        @DisplayName("a transient failure is recovered by the next attempt")
        void recoversOnRetry() {
            registry.register(TestProviders.provider("ahrefs", TestProviders.GENEROUS,
                new RetryPolicy(2, 10, true), ProviderType.SEO));
            client.script("ahrefs", attempt -> attempt == 0
                ? Mono.error(new ProviderException("ahrefs", "HTTP 503"))
                : Mono.just(SEO));
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));

            NormalizedResult result = run(request);

            assertEquals(1.0, result.metadata().completeness());
            assertEquals(2, client.callCount("ahrefs"));
            assertEquals(1, registry.getMetrics("ahrefs").successCount());
        }

        @Test
        @DisplayName("retries are bounded: maxRetries + 1 calls, then the last error is reported")
        void retriesExhausted() {
            registry.register(TestProviders.provider("ahrefs", TestProviders.GENEROUS,
                new RetryPolicy(1, 10, false), ProviderType.SEO));
            client.script("ahrefs", attempt -> Mono.error(new ProviderException("ahrefs", "attempt " + attempt)));
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));

            NormalizedResult result = run(request);

            assertEquals(0.0, result.metadata().completeness());
            assertEquals(2, client.callCount("ahrefs"));
            StreamChunk error = chunks.stream().filter(c -> c.type() == ChunkType.ERROR).findFirst().orElseThrow();
            assertEquals("[ahrefs] attempt 1", error.error().message());
        }

        @Test
        @DisplayName("quota spent after planning: attempt rejected as RATE_LIMITED without a call, provider DEGRADED")
        void rateLimitedAtAttempt() {
            registry.register(TestProviders.provider("ahrefs", new RateLimitBudget(1, 10, 100),
                TestProviders.NO_RETRY, ProviderType.SEO));
            for (int i = 0; i < 10; i++) {
                registry.updateMetrics("ahrefs", ProviderResponse.success("ahrefs", SEO, ResponseMetadata.of("r", 0, 200)));
            }
            client.answer("ahrefs", SEO);
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));
            QueryPlan plan = planner.createPlan(request);
            rateLimiter.recordRequest("ahrefs");

            NormalizedResult result = planner.executePlan(plan, request, chunks::add).block(TIMEOUT);

            assertEquals(0.0, result.metadata().completeness());
            assertEquals(0, client.callCount("ahrefs"));
            assertEquals(1, registry.getMetrics("ahrefs").rateLimitHits());
            assertEquals(11, registry.getMetrics("ahrefs").requestCount());
            assertEquals(HealthStatus.DEGRADED, registry.getMetrics("ahrefs").healthStatus());
            assertTrue(chunks.stream().anyMatch(c -> c.error() != null
                && StreamChunk.CODE_RATE_LIMITED.equals(c.error().code())));
        }

        @Test
        @DisplayName("parallel plans stream results as providers settle, merge in plan order")
        void parallelExecution() {
            ResponseMetadata slow = ResponseMetadata.of("r", 0, 2_500);
            registry.updateMetrics("ahrefs", ProviderResponse.success("ahrefs", SEO, slow));
            registry.updateMetrics("similarweb", ProviderResponse.success("similarweb", TRAFFIC, slow));
            client.script("ahrefs", attempt -> Mono.delay(Duration.ofMillis(300)).thenReturn(SEO))
                  .answer("similarweb", TRAFFIC);

            NormalizedResult result = run(seoAndTraffic());

            List<String> settledOrder = chunks.stream()
                .filter(c -> c.type() == ChunkType.RESULT)
                .map(StreamChunk::providerId)
                .toList();
            assertEquals(List.of("similarweb", "ahrefs"), settledOrder);
            assertEquals(List.of("ahrefs", "similarweb"), result.metadata().providers());
        }
    }

    // ── caching ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cache interaction")
    class CacheTests {

        @Test
        @DisplayName("an identical request is served from cache without calling any provider")
        void cacheShortCircuit() {
            client.answer("ahrefs", SEO).answer("similarweb", TRAFFIC);
            run(seoAndTraffic());
            chunks.clear();

            IntelRequest reordered = IntelRequest.of(RequestType.COMPETITOR_ANALYSIS, "acme.com",
                List.of(ProviderType.TRAFFIC, ProviderType.SEO));
            NormalizedResult cached = run(reordered);

            assertEquals(2, client.totalCalls());
            assertEquals(Freshness.CACHED, cached.metadata().freshness());
            assertSame(cache.get(reordered), cached);
            assertEquals(1, chunks.size());
            assertEquals(ChunkType.RESULT, chunks.get(0).type());
            assertEquals("Returning cached results", chunks.get(0).progress().message());
        }

        @Test
        @DisplayName("realTime requests always call providers")
        void realTimeBypasses() {
            client.answer("ahrefs", SEO).answer("similarweb", TRAFFIC);
            run(seoAndTraffic());

            run(seoAndTraffic().withOptions(new RequestOptions(true, null, null, null)));

            assertEquals(4, client.totalCalls());
        }

        @Test
        @DisplayName("cacheOnly miss still queries providers but leaves the cache untouched")
        void cacheOnlyMiss() {
            client.answer("ahrefs", SEO).answer("similarweb", TRAFFIC);
            IntelRequest request = seoAndTraffic().withOptions(new RequestOptions(null, true, null, null));

            NormalizedResult result = run(request);

            assertNotNull(result);
            assertEquals(2, client.totalCalls());
            assertFalse(cache.has(request));
        }
    }

    // ── cancellation ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("cancelRequest()")
    class CancellationTests {

        @Test
        @DisplayName("cancelling cuts an in-flight call short and completes without a result")
        void cancelInFlight() {
            client.script("ahrefs", attempt -> Mono.never());
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));
            QueryPlan plan = planner.createPlan(request);

            StepVerifier.create(planner.executePlan(plan, request, chunks::add))
                .then(() -> assertTrue(planner.cancelRequest(plan.requestId())))
                .expectComplete()
                .verify(TIMEOUT);

            assertEquals(1, client.callCount("ahrefs"));
            StreamChunk last = chunks.get(chunks.size() - 1);
            assertEquals(ChunkType.ERROR, last.type());
            assertEquals(StreamChunk.CODE_CANCELLED, last.error().code());
            assertEquals(0, planner.activeRequestCount());
        }

        @Test
        @DisplayName("cancelling during a backoff delay stops further attempts")
        void cancelDuringBackoff() {
            registry.register(TestProviders.provider("ahrefs", TestProviders.GENEROUS,
                new RetryPolicy(3, 10_000, true), ProviderType.SEO));
            client.script("ahrefs", attempt -> Mono.error(new ProviderException("ahrefs", "HTTP 500")));
            IntelRequest request = IntelRequest.of(RequestType.KEYWORD_RESEARCH, "acme.com", List.of(ProviderType.SEO));
            QueryPlan plan = planner.createPlan(request);

            StepVerifier.create(planner.executePlan(plan, request, chunks::add))
                .then(() -> planner.cancelRequest(plan.requestId()))
                .expectComplete()
                .verify(Duration.ofSeconds(2));

            assertEquals(1, client.callCount("ahrefs"));
        }

        @Test
        @DisplayName("unknown request id → false")
        void unknownRequest() {
            assertFalse(planner.cancelRequest("req_missing"));
        }
    }

    @Test
    @DisplayName("stream() emits every chunk and completes")
    void streamEmitsChunks() {
        client.answer("ahrefs", SEO).answer("similarweb", TRAFFIC);
        IntelRequest request = seoAndTraffic();
        QueryPlan plan = planner.createPlan(request);

        StepVerifier.create(planner.stream(plan, request))
            .expectNextMatches(c -> c.type() == ChunkType.PROGRESS)
            .expectNextMatches(c -> c.type() == ChunkType.RESULT && "ahrefs".equals(c.providerId()))
            .expectNextMatches(c -> c.type() == ChunkType.RESULT && "similarweb".equals(c.providerId()))
            .expectNextMatches(StreamChunk::isTerminal)
            .expectComplete()
            .verify(TIMEOUT);
    }
}
