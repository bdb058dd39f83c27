package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.common.payload.IntelPayload;

/**
 * Outcome of one provider call (or of the final attempt of a retried call).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResponse(
    @JsonProperty("providerId") String providerId,
    @JsonProperty("success") boolean success,
    @JsonProperty("data") IntelPayload data,
    @JsonProperty("error") String error,
    @JsonProperty("metadata") ResponseMetadata metadata
) {
    public static ProviderResponse success(String providerId, IntelPayload data, ResponseMetadata metadata) {
        return new ProviderResponse(providerId, true, data, null, metadata);
    }

    public static ProviderResponse failure(String providerId, String error, ResponseMetadata metadata) {
        return new ProviderResponse(providerId, false, null, error, metadata);
    }

    public long durationMs() {
        return metadata == null ? 0L : metadata.durationMs();
    }
}
