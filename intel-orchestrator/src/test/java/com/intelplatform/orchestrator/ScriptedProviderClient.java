package com.intelplatform.orchestrator;

import com.intelplatform.common.exception.ProviderException;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.orchestrator.provider.ProviderClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntFunction;

/**
 * Provider client whose answers are scripted per provider id and per attempt number
 * (zero-based). Records the wall-clock time of every call.
 */
public class ScriptedProviderClient implements ProviderClient {

    private final Map<String, IntFunction<Mono<IntelPayload>>> scripts = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> calls = new ConcurrentHashMap<>();
    private final Map<String, Mono<Void>> probes = new ConcurrentHashMap<>();

    public ScriptedProviderClient script(String providerId, IntFunction<Mono<IntelPayload>> script) {
        scripts.put(providerId, script);
        return this;
    }

    public ScriptedProviderClient answer(String providerId, IntelPayload payload) {
        return script(providerId, attempt -> Mono.just(payload));
    }

    public ScriptedProviderClient probe(String providerId, Mono<Void> result) {
        probes.put(providerId, result);
        return this;
    }

    public int callCount(String providerId) {
        return calls.getOrDefault(providerId, List.of()).size();
    }

    public List<Long> callTimesNanos(String providerId) {
        return calls.getOrDefault(providerId, List.of());
    }

    public int totalCalls() {
        return calls.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public Mono<IntelPayload> fetch(ProviderConfig provider, IntelRequest request) {
        List<Long> times = calls.computeIfAbsent(provider.id(), k -> new CopyOnWriteArrayList<>());
        int attempt = times.size();
        times.add(System.nanoTime());
        IntFunction<Mono<IntelPayload>> script = scripts.get(provider.id());
        if (script == null) {
            return Mono.error(new ProviderException(provider.id(), "unscripted"));
        }
        return script.apply(attempt);
    }

    @Override
    public Mono<Void> healthCheck(ProviderConfig provider) {
        return probes.getOrDefault(provider.id(), Mono.empty());
    }
}
