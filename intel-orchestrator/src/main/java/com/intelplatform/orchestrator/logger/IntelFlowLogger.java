package com.intelplatform.orchestrator.logger;

import com.intelplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an intelligence request's lifecycle. Pure side-effects, never alters
 * the pipeline it is attached to.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}     request accepted by the API</li>
 *   <li>{@link #PLAN_CREATED}         providers selected, strategy chosen</li>
 *   <li>{@link #CACHE_HIT}            cached result served, no provider called</li>
 *   <li>{@link #PROVIDERS_DISPATCHED} provider calls started</li>
 *   <li>{@link #PROVIDER_SETTLED}     one provider succeeded or exhausted its retries</li>
 *   <li>{@link #RESULT_NORMALIZED}    responses merged into one result</li>
 *   <li>{@link #REQUEST_COMPLETED}, {@link #REQUEST_FAILED} or {@link #REQUEST_CANCELLED}</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the request id from the Reactor Context):
 * <pre>
 *     .doOnEach(intelFlowLogger.stage(IntelFlowLogger.RESULT_NORMALIZED))
 * </pre>
 */
@Component
public class IntelFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(IntelFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String PLAN_CREATED         = "PLAN_CREATED";
    public static final String CACHE_HIT            = "CACHE_HIT";
    public static final String PROVIDERS_DISPATCHED = "PROVIDERS_DISPATCHED";
    public static final String PROVIDER_SETTLED     = "PROVIDER_SETTLED";
    public static final String RESULT_NORMALIZED    = "RESULT_NORMALIZED";
    public static final String REQUEST_COMPLETED    = "REQUEST_COMPLETED";
    public static final String REQUEST_FAILED       = "REQUEST_FAILED";
    public static final String REQUEST_CANCELLED    = "REQUEST_CANCELLED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * Bridges Context to MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String requestId = TraceContextUtil.requestIdOf(signal.getContextView()).orElse("unknown");
            TraceContextUtil.logScoped(requestId, () ->
                log.info("[IntelFlow] stage={} requestId={}", stageName, requestId)
            );
        };
    }

    public void logWithRequestId(String stageName, String requestId) {
        TraceContextUtil.logScoped(requestId, () ->
            log.info("[IntelFlow] stage={} requestId={}", stageName, requestId)
        );
    }

    /** Same as {@link #logWithRequestId(String, String)} with a free-form {@code key=value} tail. */
    public void logWithRequestId(String stageName, String requestId, String details) {
        TraceContextUtil.logScoped(requestId, () ->
            log.info("[IntelFlow] stage={} requestId={} {}", stageName, requestId, details)
        );
    }
}
