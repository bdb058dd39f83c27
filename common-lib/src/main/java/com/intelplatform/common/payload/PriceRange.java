package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceRange(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max,
    @JsonProperty("avg") double avg,
    @JsonProperty("currency") String currency
) {}
