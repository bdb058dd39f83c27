package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.exception.RequestCancelledException;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.IntelRequests;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.StreamChunk;
import com.intelplatform.orchestrator.controller.dto.IntelQueryResponse;
import com.intelplatform.orchestrator.controller.dto.PlanSummary;
import com.intelplatform.orchestrator.controller.dto.QueryMetadata;
import com.intelplatform.orchestrator.planner.QueryPlan;
import com.intelplatform.orchestrator.planner.QueryPlanner;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Query submission and cancellation.
 *
 * <p>{@code POST /query} negotiates on {@code Accept}: {@code text/event-stream} streams
 * {@code status}, {@code plan}, one {@code chunk} per {@link StreamChunk}, then {@code complete}
 * (or {@code error}); anything else gets one JSON document with every chunk bundled.
 * Planning errors are raised before the first byte and mapped by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/intel")
public class IntelController {

    private static final Logger log = LoggerFactory.getLogger(IntelController.class);

    private final QueryPlanner queryPlanner;
    private final Clock clock;

    public IntelController(QueryPlanner queryPlanner, Clock clock) {
        this.queryPlanner = queryPlanner;
        this.clock = clock;
    }

    @PostMapping(value = "/query", produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_EVENT_STREAM_VALUE})
    public Publisher<?> query(
            @RequestBody IntelRequest request,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        IntelRequests.validate(request);
        QueryPlan plan = queryPlanner.createPlan(request);
        boolean streaming = accept != null && accept.contains(MediaType.TEXT_EVENT_STREAM_VALUE);
        log.info("Intel query accepted. requestId={} type={} target={} streaming={}",
                 plan.requestId(), request.type().wireName(), request.target(), streaming);
        return streaming ? stream(plan, request) : collect(plan, request);
    }

    @DeleteMapping("/requests/{requestId}")
    public Mono<Map<String, Object>> cancel(@PathVariable String requestId) {
        boolean cancelled = queryPlanner.cancelRequest(requestId);
        log.info("Cancel requested. requestId={} cancelled={}", requestId, cancelled);
        return Mono.just(Map.<String, Object>of("requestId", requestId, "cancelled", cancelled));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Flux<ServerSentEvent<Object>> stream(QueryPlan plan, IntelRequest request) {
        Flux<ServerSentEvent<Object>> head = Flux.just(
            event("status", Map.of("message", "Starting intelligence query...", "request", request)),
            event("plan", PlanSummary.of(plan)));

        Flux<ServerSentEvent<Object>> body = queryPlanner.stream(plan, request)
            .concatMap(chunk -> chunk.data() instanceof NormalizedResult result
                ? Flux.just(event("chunk", chunk), event("complete",
                    new IntelQueryResponse(plan.requestId(), result, null, metadata(plan))))
                : Flux.just(event("chunk", chunk)))
            .onErrorResume(e -> {
                log.error("Intel stream failed. requestId={}", plan.requestId(), e);
                return Flux.just(event("error", Map.of("error",
                    e.getMessage() != null ? e.getMessage() : "Unknown error")));
            });

        return head.concatWith(body);
    }

    private Mono<IntelQueryResponse> collect(QueryPlan plan, IntelRequest request) {
        List<StreamChunk> chunks = new CopyOnWriteArrayList<>();
        return queryPlanner.executePlan(plan, request, chunks::add)
            .map(result -> new IntelQueryResponse(plan.requestId(), result, List.copyOf(chunks), metadata(plan)))
            .switchIfEmpty(Mono.error(() -> new RequestCancelledException(plan.requestId())));
    }

    private QueryMetadata metadata(QueryPlan plan) {
        return new QueryMetadata(clock.instant(), plan.providers().size(), plan.estimatedDuration());
    }

    private static ServerSentEvent<Object> event(String name, Object data) {
        return ServerSentEvent.<Object>builder()
            .event(name)
            .data(data)
            .build();
    }
}
