package com.intelplatform.orchestrator.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keys set at runtime win over {@code intel.credentials.<providerId>} from configuration.
 */
@Component
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

    static final String PROPERTY_PREFIX = "intel.credentials.";

    private final Environment environment;
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    public InMemoryCredentialStore(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> resolveApiKey(String providerId) {
        String key = overrides.get(providerId);
        if (key == null) {
            key = environment.getProperty(PROPERTY_PREFIX + providerId);
        }
        return Optional.ofNullable(key).filter(k -> !k.isBlank());
    }

    @Override
    public void updateApiKey(String providerId, String apiKey) {
        overrides.put(providerId, apiKey);
        log.info("CREDENTIALS_UPDATED provider={}", providerId);
    }
}
