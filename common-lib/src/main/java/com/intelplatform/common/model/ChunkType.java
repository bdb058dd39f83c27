package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChunkType {
    PROGRESS,
    RESULT,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
