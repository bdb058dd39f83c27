package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.exception.NoEligibleProvidersException;
import com.intelplatform.common.model.Freshness;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.model.RequestType;
import com.intelplatform.common.model.ResultMetadata;
import com.intelplatform.common.model.StreamChunk;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.payload.SeoData;
import com.intelplatform.orchestrator.MutableClock;
import com.intelplatform.orchestrator.TestProviders;
import com.intelplatform.orchestrator.planner.CacheStrategy;
import com.intelplatform.orchestrator.planner.PlanPriority;
import com.intelplatform.orchestrator.planner.QueryPlan;
import com.intelplatform.orchestrator.planner.QueryPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = IntelController.class)
class IntelControllerTest {

    private static final String BODY = """
        {"type":"keyword_research","target":"acme.com","providers":["seo"]}
        """;

    private static final QueryPlan PLAN = new QueryPlan("req_1_abcd1234",
        List.of(TestProviders.provider("ahrefs", ProviderType.SEO)),
        1000, CacheStrategy.PREFER_CACHE, false, PlanPriority.LOW);

    private static final NormalizedResult RESULT = new NormalizedResult(
        RequestType.KEYWORD_RESEARCH, "acme.com",
        IntelPayload.ofSeo(new SeoData(55, null, null, null, null)),
        new ResultMetadata(List.of("ahrefs"), 0L, Freshness.FRESH, 1.0));

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private QueryPlanner queryPlanner;

    @Test
    @DisplayName("POST /query (JSON) returns the result with every chunk bundled")
    @SuppressWarnings("unchecked")
    void jsonQuery() {
        when(queryPlanner.createPlan(any(IntelRequest.class))).thenReturn(PLAN);
        when(queryPlanner.executePlan(eq(PLAN), any(IntelRequest.class), any())).thenAnswer(inv -> {
            Consumer<StreamChunk> onChunk = inv.getArgument(2);
            onChunk.accept(StreamChunk.progress(0, 1, "Querying 1 providers..."));
            onChunk.accept(StreamChunk.complete(RESULT, 1));
            return Mono.just(RESULT);
        });

        webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.requestId").isEqualTo("req_1_abcd1234")
            .jsonPath("$.result.data.seo.domainAuthority").isEqualTo(55)
            .jsonPath("$.result.metadata.freshness").isEqualTo("fresh")
            .jsonPath("$.chunks.length()").isEqualTo(2)
            .jsonPath("$.chunks[0].type").isEqualTo("progress")
            .jsonPath("$.metadata.providersUsed").isEqualTo(1)
            .jsonPath("$.metadata.completedAt").isEqualTo("2024-03-01T10:00:00Z");
    }

    @Test
    @DisplayName("missing required fields → 400 listing them, nothing planned")
    void missingFields() {
        webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"type\":\"keyword_research\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_REQUEST")
            .jsonPath("$.message").isEqualTo("Missing required fields: target, providers");

        verify(queryPlanner, never()).createPlan(any());
    }

    @Test
    @DisplayName("no eligible providers → 422")
    void noEligibleProviders() {
        when(queryPlanner.createPlan(any(IntelRequest.class)))
            .thenThrow(new NoEligibleProvidersException("No healthy providers available for [seo]"));

        webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.code").isEqualTo("NO_ELIGIBLE_PROVIDERS");
    }

    @Test
    @DisplayName("cancelled JSON query → 409")
    void cancelledQuery() {
        when(queryPlanner.createPlan(any(IntelRequest.class))).thenReturn(PLAN);
        when(queryPlanner.executePlan(eq(PLAN), any(IntelRequest.class), any())).thenReturn(Mono.empty());

        webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.code").isEqualTo("REQUEST_CANCELLED");
    }

    @Test
    @DisplayName("POST /query (SSE) streams status, plan, chunks, then complete")
    void streamingQuery() {
        when(queryPlanner.createPlan(any(IntelRequest.class))).thenReturn(PLAN);
        when(queryPlanner.stream(eq(PLAN), any(IntelRequest.class))).thenReturn(Flux.just(
            StreamChunk.progress(0, 1, "Querying 1 providers..."),
            StreamChunk.result("ahrefs", RESULT.data(), new StreamChunk.Progress(1, 1, "Received data from AHREFS")),
            StreamChunk.complete(RESULT, 1)));

        List<ServerSentEvent<String>> events = webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
            .getResponseBody()
            .collectList()
            .block();

        assertNotNull(events);
        assertEquals(List.of("status", "plan", "chunk", "chunk", "chunk", "complete"),
            events.stream().map(ServerSentEvent::event).toList());
        assertTrue(events.get(1).data().contains("\"cacheStrategy\":\"prefer_cache\""));
        assertTrue(events.get(5).data().contains("\"requestId\":\"req_1_abcd1234\""));
        assertFalse(events.get(5).data().contains("\"chunks\""));
    }

    @Test
    @DisplayName("a failing stream ends with an error event")
    void streamingFailure() {
        when(queryPlanner.createPlan(any(IntelRequest.class))).thenReturn(PLAN);
        when(queryPlanner.stream(eq(PLAN), any(IntelRequest.class)))
            .thenReturn(Flux.error(new IllegalStateException("normalizer blew up")));

        List<ServerSentEvent<String>> events = webTestClient.post()
            .uri("/api/v1/intel/query")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
            .getResponseBody()
            .collectList()
            .block();

        assertNotNull(events);
        ServerSentEvent<String> last = events.get(events.size() - 1);
        assertEquals("error", last.event());
        assertTrue(last.data().contains("normalizer blew up"));
    }

    @Test
    @DisplayName("DELETE /requests/{id} reports whether a request was cancelled")
    void cancelEndpoint() {
        when(queryPlanner.cancelRequest("req_1_abcd1234")).thenReturn(true);

        webTestClient.delete()
            .uri("/api/v1/intel/requests/{id}", "req_1_abcd1234")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.requestId").isEqualTo("req_1_abcd1234")
            .jsonPath("$.cancelled").isEqualTo(true);
    }
}
