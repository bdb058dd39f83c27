package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrafficData(
    @JsonProperty("monthlyVisits") Long monthlyVisits,
    @JsonProperty("bounceRate") Double bounceRate,
    @JsonProperty("avgSessionDuration") Double avgSessionDuration,
    @JsonProperty("pagesPerSession") Double pagesPerSession,
    @JsonProperty("trafficSources") TrafficSources trafficSources
) {
    @JsonIgnore
    public boolean hasSignature() {
        return monthlyVisits != null || bounceRate != null;
    }
}
