package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformAudience(
    @JsonProperty("followers") long followers,
    @JsonProperty("engagement") double engagement
) {}
