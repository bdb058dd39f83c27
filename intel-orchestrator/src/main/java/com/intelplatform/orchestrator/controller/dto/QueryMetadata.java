package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record QueryMetadata(
    @JsonProperty("completedAt") Instant completedAt,
    @JsonProperty("providersUsed") int providersUsed,
    @JsonProperty("estimatedDuration") long estimatedDuration
) {}
