package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.orchestrator.planner.CacheStrategy;
import com.intelplatform.orchestrator.planner.PlanPriority;
import com.intelplatform.orchestrator.planner.QueryPlan;

import java.util.List;

public record PlanSummary(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("providers") List<ProviderRef> providers,
    @JsonProperty("estimatedDuration") long estimatedDuration,
    @JsonProperty("cacheStrategy") CacheStrategy cacheStrategy,
    @JsonProperty("parallelExecution") boolean parallelExecution,
    @JsonProperty("priority") PlanPriority priority
) {
    public record ProviderRef(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
    ) {}

    public static PlanSummary of(QueryPlan plan) {
        return new PlanSummary(
            plan.requestId(),
            plan.providers().stream().map(p -> new ProviderRef(p.id(), p.name())).toList(),
            plan.estimatedDuration(),
            plan.cacheStrategy(),
            plan.parallelExecution(),
            plan.priority());
    }
}
