package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthCheckSpec(
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("intervalMs") long intervalMs
) {}
