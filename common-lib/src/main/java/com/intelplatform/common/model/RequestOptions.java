package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied execution hints.
 *
 * <p>{@code realTime} bypasses the cache, {@code cacheOnly} suppresses the cache write.
 * {@code country} and {@code language} take part in the request fingerprint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestOptions(
    @JsonProperty("realTime") Boolean realTime,
    @JsonProperty("cacheOnly") Boolean cacheOnly,
    @JsonProperty("country") String country,
    @JsonProperty("language") String language
) {
    public static RequestOptions none() {
        return new RequestOptions(null, null, null, null);
    }

    @JsonIgnore
    public boolean isRealTime() {
        return Boolean.TRUE.equals(realTime);
    }

    @JsonIgnore
    public boolean isCacheOnly() {
        return Boolean.TRUE.equals(cacheOnly);
    }
}
