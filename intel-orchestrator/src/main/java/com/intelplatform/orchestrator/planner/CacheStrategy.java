package com.intelplatform.orchestrator.planner;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CacheStrategy {
    /** Serve from cache on hit, otherwise query providers and cache the result. */
    PREFER_CACHE,
    /** Never read the cache; the fresh result is still written. */
    BYPASS_CACHE,
    /** Serve from cache on hit; a miss still queries providers but the result is not written back. */
    CACHE_ONLY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
