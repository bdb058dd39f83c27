package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Freshness {
    FRESH,
    CACHED,
    STALE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
