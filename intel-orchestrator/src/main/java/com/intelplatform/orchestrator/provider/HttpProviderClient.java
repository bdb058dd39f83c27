package com.intelplatform.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.intelplatform.common.exception.IntelException;
import com.intelplatform.common.exception.ProviderException;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.payload.IntelPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Live provider adapter: {@code GET {baseUrl}/{operation}?target=...&apikey=...}.
 *
 * <p>The operation is the provider's first supported operation. Any transport, status or
 * mapping failure surfaces as a {@link ProviderException} carrying the provider id.
 */
@Service
public class HttpProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderClient.class);

    static final String DEFAULT_OPERATION = "query";

    private final WebClient webClient;
    private final CredentialStore credentials;
    private final ProviderPayloadMapper payloadMapper;

    public HttpProviderClient(WebClient providerWebClient,
                              CredentialStore credentials,
                              ProviderPayloadMapper payloadMapper) {
        this.webClient     = providerWebClient;
        this.credentials   = credentials;
        this.payloadMapper = payloadMapper;
    }

    @Override
    public Mono<IntelPayload> fetch(ProviderConfig provider, IntelRequest request) {
        return Mono.defer(() -> {
            String apiKey = credentials.resolveApiKey(provider.id()).orElse(null);
            if (apiKey == null) {
                return Mono.error(new ProviderException(provider.id(), "No credentials configured"));
            }
            URI uri = queryUri(provider, request, apiKey);
            log.debug("PROVIDER_FETCH provider={} target={}", provider.id(), request.target());
            return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(body -> payloadMapper.map(provider.id(), body))
                .defaultIfEmpty(IntelPayload.empty());
        })
        .onErrorMap(e -> !(e instanceof IntelException), e -> toProviderException(provider.id(), e));
    }

    @Override
    public Mono<Void> healthCheck(ProviderConfig provider) {
        return Mono.defer(() -> {
            String endpoint = provider.healthCheck() == null ? "" : provider.healthCheck().endpoint();
            UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(provider.baseUrl()).path(endpoint);
            credentials.resolveApiKey(provider.id()).ifPresent(key -> builder.queryParam("apikey", key));
            return webClient.get()
                .uri(builder.build().encode().toUri())
                .retrieve()
                .toBodilessEntity()
                .then();
        })
        .onErrorMap(e -> !(e instanceof IntelException), e -> toProviderException(provider.id(), e));
    }

    URI queryUri(ProviderConfig provider, IntelRequest request, String apiKey) {
        String operation = provider.supportedOperations().isEmpty()
            ? DEFAULT_OPERATION
            : provider.supportedOperations().get(0);
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(provider.baseUrl())
            .path("/" + operation)
            .queryParam("target", request.target())
            .queryParam("apikey", apiKey);
        if (!request.keywords().isEmpty()) {
            builder.queryParam("keywords", String.join(",", request.keywords()));
        }
        if (request.location() != null) {
            builder.queryParam("location", request.location());
        }
        return builder.build().encode().toUri();
    }

    private static ProviderException toProviderException(String providerId, Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return new ProviderException(providerId,
                "HTTP " + wcre.getStatusCode().value() + " " + wcre.getStatusText(), e);
        }
        return new ProviderException(providerId,
            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }
}
