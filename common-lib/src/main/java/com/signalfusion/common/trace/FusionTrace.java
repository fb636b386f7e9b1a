package com.signalfusion.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.function.Function;

/**
 * Carries one fusion request's trace id from the inbound {@code X-Trace-Id} header, through
 * the Reactor Context of every pipeline it fans out into, to the outbound gateway calls and
 * the log lines.
 *
 * <p>The Reactor Context is the only store. MDC holds the id just for the duration of a
 * single log call ({@link #logScoped}); pipelines hop threads, so a ThreadLocal would leak
 * ids between requests.
 */
public final class FusionTrace {

    public static final String HEADER = "X-Trace-Id";
    /** Context key and MDC key; {@code logback-spring.xml} prints it as {@code %X{traceId}}. */
    public static final String CONTEXT_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private FusionTrace() {}

    /** The caller's id when it sent one, otherwise a fresh UUID. */
    public static String resolve(String header) {
        return header == null || header.isBlank() ? UUID.randomUUID().toString() : header.trim();
    }

    /**
     * Binds {@code traceId} to {@code pipeline}. {@code contextWrite} applies upstream, so
     * this goes last, after the whole pipeline is assembled.
     */
    public static <T> Mono<T> bind(Mono<T> pipeline, String traceId) {
        return pipeline.contextWrite(ctx -> ctx.put(CONTEXT_KEY, traceId));
    }

    public static String current(ContextView ctx) {
        return ctx.getOrDefault(CONTEXT_KEY, UNKNOWN);
    }

    /**
     * Defers {@code call} until subscription and hands it the bound trace id, typically to
     * forward as {@link #HEADER} on a downstream request.
     */
    public static <T> Mono<T> propagate(Function<String, Mono<T>> call) {
        return Mono.deferContextual(ctx -> call.apply(current(ctx)));
    }

    public static void logScoped(String traceId, Runnable logAction) {
        MDC.put(CONTEXT_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CONTEXT_KEY);
        }
    }
}
