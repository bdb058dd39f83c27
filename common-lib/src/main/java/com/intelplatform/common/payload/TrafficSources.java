package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Share of visits per acquisition channel, each in [0, 1]. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrafficSources(
    @JsonProperty("direct") Double direct,
    @JsonProperty("search") Double search,
    @JsonProperty("social") Double social,
    @JsonProperty("referral") Double referral,
    @JsonProperty("paid") Double paid
) {}
