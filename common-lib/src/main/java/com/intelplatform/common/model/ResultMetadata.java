package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ResultMetadata(
    @JsonProperty("providers") List<String> providers,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("freshness") Freshness freshness,
    @JsonProperty("completeness") double completeness
) {
    public ResultMetadata {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }
}
