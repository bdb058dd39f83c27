package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.common.model.ProviderType;

import java.util.List;

/**
 * {@code status} is {@code healthy} when every provider is usable, {@code unhealthy} when
 * none is, {@code degraded} in between.
 */
public record ProviderHealthReport(
    @JsonProperty("status") String status,
    @JsonProperty("providers") List<ProviderHealth> providers
) {
    public record ProviderHealth(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") List<ProviderType> type,
        @JsonProperty("healthy") boolean healthy
    ) {}

    public static ProviderHealthReport of(List<ProviderHealth> providers) {
        long healthy = providers.stream().filter(ProviderHealth::healthy).count();
        String status;
        if (healthy == providers.size()) {
            status = "healthy";
        } else if (healthy == 0) {
            status = "unhealthy";
        } else {
            status = "degraded";
        }
        return new ProviderHealthReport(status, providers);
    }
}
