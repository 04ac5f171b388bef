package com.tradesignal.signal.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a per-request traceId through the reactive evaluation pipeline.
 *
 * <p>The Reactor Context is the only store; MDC is written just for the duration of a
 * single log statement via {@link #withMdc}, never left behind on a pooled thread.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Stores {@code traceId} in the Context of {@code mono}; call at the end of assembly. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Returns the traceId from {@code ctx}, or {@code "unknown"} — never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** The caller-supplied id when present, otherwise a fresh random one. */
    public static String resolve(String headerValue) {
        return (headerValue == null || headerValue.isBlank())
            ? UUID.randomUUID().toString()
            : headerValue.trim();
    }

    /** Runs {@code action} with {@code traceId} in MDC, then removes it. */
    public static void withMdc(String traceId, Runnable action) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            action.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
