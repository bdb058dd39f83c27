package com.intelplatform.orchestrator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared outbound client for every third-party provider. Provider base URLs differ, so
 * requests use absolute URIs; timeouts bound a single attempt, retries live in the planner.
 */
@Configuration
public class ProviderWebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderWebClientConfig.class);

    @Value("${intel.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${intel.http.response-timeout-seconds:15}")
    private int responseTimeoutSeconds;

    @Bean
    public WebClient providerWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("(?i)apikey=[^&]+", "apikey=***");
            log.debug("Outbound provider request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
