package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.intelplatform.common.payload.IntelPayload;

/**
 * Unified result merged from every provider that answered a request.
 * A data section is present only when at least one provider supplied it.
 */
public record NormalizedResult(
    @JsonProperty("type") RequestType type,
    @JsonProperty("target") String target,
    @JsonProperty("data") IntelPayload data,
    @JsonProperty("metadata") ResultMetadata metadata
) {
    public NormalizedResult withFreshness(Freshness freshness) {
        return new NormalizedResult(type, target, data,
            new ResultMetadata(metadata.providers(), metadata.timestamp(), freshness, metadata.completeness()));
    }
}
