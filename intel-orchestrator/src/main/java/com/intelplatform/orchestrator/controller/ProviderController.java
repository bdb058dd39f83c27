package com.intelplatform.orchestrator.controller;

import com.intelplatform.common.exception.InvalidIntelRequestException;
import com.intelplatform.common.exception.UnknownProviderException;
import com.intelplatform.common.model.ProviderMetrics;
import com.intelplatform.orchestrator.controller.dto.CredentialUpdateRequest;
import com.intelplatform.orchestrator.controller.dto.ProviderHealthReport;
import com.intelplatform.orchestrator.controller.dto.ProviderOverview;
import com.intelplatform.orchestrator.provider.CredentialStore;
import com.intelplatform.orchestrator.ratelimit.RateLimitState;
import com.intelplatform.orchestrator.ratelimit.RateWindow;
import com.intelplatform.orchestrator.ratelimit.WindowedRateLimiter;
import com.intelplatform.orchestrator.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/intel")
public class ProviderController {

    private static final Logger log = LoggerFactory.getLogger(ProviderController.class);

    private final ProviderRegistry registry;
    private final WindowedRateLimiter rateLimiter;
    private final CredentialStore credentials;

    public ProviderController(ProviderRegistry registry,
                              WindowedRateLimiter rateLimiter,
                              CredentialStore credentials) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.credentials = credentials;
    }

    @GetMapping("/providers")
    public Mono<ProviderOverview> providers() {
        Map<String, ProviderMetrics> metrics = new LinkedHashMap<>();
        registry.getAllMetrics().forEach(m -> metrics.put(m.providerId(), m));
        return Mono.just(new ProviderOverview(registry.getAllProviders(), metrics));
    }

    @GetMapping("/providers/health")
    public Mono<ProviderHealthReport> health() {
        return Mono.just(ProviderHealthReport.of(registry.getAllProviders().stream()
            .map(p -> new ProviderHealthReport.ProviderHealth(p.id(), p.name(), p.types(), registry.isHealthy(p.id())))
            .toList()));
    }

    @GetMapping("/rate-limits")
    public Mono<Map<String, Map<RateWindow, RateLimitState>>> rateLimits() {
        return Mono.just(rateLimiter.getStatus());
    }

    @PostMapping("/credentials")
    public Mono<Map<String, Object>> updateCredentials(@RequestBody CredentialUpdateRequest request) {
        if (request.providerId() == null || request.providerId().isBlank() || request.credentials() == null) {
            throw new InvalidIntelRequestException("Missing providerId or credentials");
        }
        if (request.apiKey() == null || request.apiKey().isBlank()) {
            throw new InvalidIntelRequestException("Invalid credentials format. Expected { apiKey: string }");
        }
        if (registry.getProvider(request.providerId()) == null) {
            throw new UnknownProviderException(request.providerId());
        }
        credentials.updateApiKey(request.providerId(), request.apiKey());
        log.info("Credentials stored. provider={}", request.providerId());
        return Mono.just(Map.<String, Object>of(
            "success", true,
            "message", "Credentials stored for " + request.providerId()));
    }
}
