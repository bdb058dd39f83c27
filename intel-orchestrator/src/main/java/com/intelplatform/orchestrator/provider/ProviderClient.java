package com.intelplatform.orchestrator.provider;

import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.payload.IntelPayload;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for talking to third-party intelligence providers.
 * One attempt per subscription: retries, rate limiting and metrics belong to the caller.
 */
public interface ProviderClient {

    /**
     * Fetches the provider's payload for {@code request}. Errors with a
     * {@link com.intelplatform.common.exception.ProviderException} on any failure.
     */
    Mono<IntelPayload> fetch(ProviderConfig provider, IntelRequest request);

    /** Completes when the provider's health endpoint answers; errors otherwise. */
    Mono<Void> healthCheck(ProviderConfig provider);
}
