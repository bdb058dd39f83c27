package com.intelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived provider health. {@code DEGRADED} providers are still eligible for planning;
 * {@code UNHEALTHY} ones never are.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public boolean isUsable() {
        return this != UNHEALTHY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
