package com.intelplatform.common.trace;

import org.slf4j.MDC;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.Optional;
import java.util.function.Function;

/**
 * Carries the request id of an intelligence query through its reactive pipeline.
 *
 * <p>The id lives in the Reactor {@link Context}. Log statements see it through MDC, but only
 * while {@link #logScoped} runs, so pooled scheduler threads never leak one request's id
 * into another's log lines.
 *
 * <pre>
 *     pipeline.contextWrite(TraceContextUtil.requestId(plan.requestId()))
 * </pre>
 */
public final class TraceContextUtil {

    /** Context and MDC key, referenced as {@code %X{requestId}} by the console pattern. */
    public static final String REQUEST_ID_KEY = "requestId";

    private TraceContextUtil() {}

    /** Context mutation for {@code contextWrite}; apply it last, it is visible upstream only. */
    public static Function<Context, Context> requestId(String requestId) {
        return ctx -> requestId == null ? ctx : ctx.put(REQUEST_ID_KEY, requestId);
    }

    public static Optional<String> requestIdOf(ContextView ctx) {
        return ctx.getOrEmpty(REQUEST_ID_KEY);
    }

    /**
     * Runs {@code logAction} with the request id in MDC and removes it afterwards.
     * A {@code null} id runs the action without touching MDC.
     */
    public static void logScoped(String requestId, Runnable logAction) {
        if (requestId == null) {
            logAction.run();
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(REQUEST_ID_KEY, requestId)) {
            logAction.run();
        }
    }
}
