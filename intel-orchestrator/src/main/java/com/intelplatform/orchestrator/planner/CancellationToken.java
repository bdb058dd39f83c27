package com.intelplatform.orchestrator.planner;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Per-request cancellation flag. {@link #whenCancelled()} emits once on cancel so in-flight
 * provider calls and backoff delays can be cut short with {@code takeUntilOther}.
 */
final class CancellationToken {

    private final String requestId;
    private final Sinks.One<Boolean> signal = Sinks.one();
    private volatile boolean cancelled;

    CancellationToken(String requestId) {
        this.requestId = requestId;
    }

    String requestId() {
        return requestId;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        cancelled = true;
        signal.tryEmitValue(Boolean.TRUE);
    }

    Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }
}
