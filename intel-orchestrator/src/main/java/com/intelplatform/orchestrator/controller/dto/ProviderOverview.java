package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.ProviderMetrics;

import java.util.List;
import java.util.Map;

public record ProviderOverview(
    @JsonProperty("providers") List<ProviderConfig> providers,
    @JsonProperty("metrics") Map<String, ProviderMetrics> metrics
) {}
