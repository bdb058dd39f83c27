package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data category a provider can answer for. A single provider may implement several.
 */
public enum ProviderType {
    SEO("seo"),
    TRAFFIC("traffic"),
    PRICING("pricing"),
    SERP("serp"),
    SOCIAL("social"),
    REVIEWS("reviews");

    private final String wireName;

    ProviderType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ProviderType fromWire(String value) {
        for (ProviderType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }
}
