package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMetadata(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("durationMs") long durationMs,
    @JsonProperty("cached") boolean cached,
    @JsonProperty("ttl") Long ttl
) {
    public static ResponseMetadata of(String requestId, long timestamp, long durationMs) {
        return new ResponseMetadata(requestId, timestamp, durationMs, false, null);
    }
}
