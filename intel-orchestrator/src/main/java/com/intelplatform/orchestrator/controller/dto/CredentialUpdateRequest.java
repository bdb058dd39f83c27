package com.intelplatform.orchestrator.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CredentialUpdateRequest(
    @JsonProperty("providerId") String providerId,
    @JsonProperty("credentials") Credentials credentials
) {
    public record Credentials(@JsonProperty("apiKey") String apiKey) {}

    public String apiKey() {
        return credentials == null ? null : credentials.apiKey();
    }
}
