package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RateLimitBudget(
    @JsonProperty("requestsPerMinute") int requestsPerMinute,
    @JsonProperty("requestsPerHour") int requestsPerHour,
    @JsonProperty("requestsPerDay") int requestsPerDay
) {}
