package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static descriptor of a third-party data provider. Immutable once registered; the
 * provider's live health lives in {@link ProviderMetrics}.
 */
public record ProviderConfig(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("type") List<ProviderType> types,
    @JsonProperty("baseUrl") String baseUrl,
    @JsonProperty("rateLimit") RateLimitBudget rateLimit,
    @JsonProperty("retryConfig") RetryPolicy retryConfig,
    @JsonProperty("healthCheck") HealthCheckSpec healthCheck,
    @JsonProperty("supportedOperations") List<String> supportedOperations
) {
    public ProviderConfig {
        types = types == null ? List.of() : List.copyOf(types);
        supportedOperations = supportedOperations == null ? List.of() : List.copyOf(supportedOperations);
    }

    public boolean supports(ProviderType type) {
        return types.contains(type);
    }
}
