package com.intelplatform.orchestrator.planner;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanPriority {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
