package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of intelligence a caller asks for. Drives cache TTL and plan priority.
 */
public enum RequestType {
    COMPETITOR_ANALYSIS("competitor_analysis"),
    KEYWORD_RESEARCH("keyword_research"),
    MARKET_ANALYSIS("market_analysis"),
    PRICING_INTELLIGENCE("pricing_intelligence");

    private final String wireName;

    RequestType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RequestType fromWire(String value) {
        for (RequestType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + value);
    }
}
