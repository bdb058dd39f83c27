package com.intelplatform.orchestrator.planner;

import com.intelplatform.common.model.ProviderConfig;

import java.util.List;

/**
 * Execution plan for one request. {@code providers} is never empty.
 */
public record QueryPlan(
    String requestId,
    List<ProviderConfig> providers,
    long estimatedDuration,
    CacheStrategy cacheStrategy,
    boolean parallelExecution,
    PlanPriority priority
) {
    public QueryPlan {
        providers = List.copyOf(providers);
    }

    public List<String> providerIds() {
        return providers.stream().map(ProviderConfig::id).toList();
    }
}
