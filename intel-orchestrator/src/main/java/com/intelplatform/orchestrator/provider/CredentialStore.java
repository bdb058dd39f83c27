package com.intelplatform.orchestrator.provider;

import java.util.Optional;

/**
 * Source of provider API keys. Keys never appear in logs or API responses.
 */
public interface CredentialStore {

    Optional<String> resolveApiKey(String providerId);

    void updateApiKey(String providerId, String apiKey);
}
