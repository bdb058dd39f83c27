package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.model.HealthStatus;
import com.intelplatform.common.model.ProviderMetrics;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.orchestrator.TestProviders;
import com.intelplatform.orchestrator.provider.CredentialStore;
import com.intelplatform.orchestrator.ratelimit.WindowedRateLimiter;
import com.intelplatform.orchestrator.registry.ProviderRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ProviderController.class)
class ProviderControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ProviderRegistry registry;

    @MockBean
    private WindowedRateLimiter rateLimiter;

    @MockBean
    private CredentialStore credentials;

    @Test
    @DisplayName("POST /credentials stores the key for a known provider")
    void storesCredentials() {
        when(registry.getProvider("ahrefs")).thenReturn(TestProviders.provider("ahrefs", ProviderType.SEO));

        postCredentials("{\"providerId\":\"ahrefs\",\"credentials\":{\"apiKey\":\"k-123\"}}")
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.success").isEqualTo(true);

        verify(credentials).updateApiKey("ahrefs", "k-123");
    }

    @Test
    @DisplayName("missing providerId or credentials → 400")
    void missingFields() {
        postCredentials("{\"providerId\":\"ahrefs\"}")
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Missing providerId or credentials");

        verify(credentials, never()).updateApiKey(anyString(), anyString());
    }

    @Test
    @DisplayName("credentials without an apiKey → 400")
    void missingApiKey() {
        postCredentials("{\"providerId\":\"ahrefs\",\"credentials\":{\"token\":\"x\"}}")
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("unknown provider → 404")
    void unknownProvider() {
        postCredentials("{\"providerId\":\"nope\",\"credentials\":{\"apiKey\":\"k\"}}")
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.code").isEqualTo("UNKNOWN_PROVIDER")
            .jsonPath("$.message").isEqualTo("Unknown provider: nope");
    }

    @Test
    @DisplayName("GET /providers/health reports degraded when some providers are unhealthy")
    void healthReport() {
        when(registry.getAllProviders()).thenReturn(List.of(
            TestProviders.provider("ahrefs", ProviderType.SEO),
            TestProviders.provider("similarweb", ProviderType.TRAFFIC)));
        when(registry.isHealthy("ahrefs")).thenReturn(true);
        when(registry.isHealthy("similarweb")).thenReturn(false);

        webTestClient.get()
            .uri("/api/v1/intel/providers/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("degraded")
            .jsonPath("$.providers.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("GET /providers lists configs and metrics keyed by provider id")
    void providerOverview() {
        when(registry.getAllProviders()).thenReturn(List.of(TestProviders.provider("ahrefs", ProviderType.SEO)));
        when(registry.getAllMetrics()).thenReturn(List.of(
            ProviderMetrics.initial("ahrefs").withHealth(HealthStatus.DEGRADED)));

        webTestClient.get()
            .uri("/api/v1/intel/providers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.providers[0].id").isEqualTo("ahrefs")
            .jsonPath("$.metrics.ahrefs.healthStatus").isEqualTo("degraded");
    }

    private WebTestClient.ResponseSpec postCredentials(String json) {
        return webTestClient.post()
            .uri("/api/v1/intel/credentials")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(json)
            .exchange();
    }
}
