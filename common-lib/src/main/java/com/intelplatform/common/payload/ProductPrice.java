package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductPrice(
    @JsonProperty("name") String name,
    @JsonProperty("price") Double price,
    @JsonProperty("currency") String currency,
    @JsonProperty("availability") Boolean availability,
    @JsonProperty("lastUpdated") Long lastUpdated
) {}
