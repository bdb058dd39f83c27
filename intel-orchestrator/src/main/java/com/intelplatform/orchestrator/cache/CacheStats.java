package com.intelplatform.orchestrator.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CacheStats(
    @JsonProperty("size") int size,
    @JsonProperty("maxEntries") int maxEntries,
    @JsonProperty("hits") long hits,
    @JsonProperty("misses") long misses,
    @JsonProperty("hitRate") double hitRate,
    @JsonProperty("entries") List<EntryStats> entries
) {
    public record EntryStats(
        @JsonProperty("key") String key,
        @JsonProperty("type") String type,
        @JsonProperty("target") String target,
        @JsonProperty("ageMs") long ageMs,
        @JsonProperty("ttlMs") long ttlMs
    ) {}
}
