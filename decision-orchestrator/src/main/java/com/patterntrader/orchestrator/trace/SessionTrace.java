package com.patterntrader.orchestrator.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.LocalDate;

/**
 * Session id propagation through a reactive session run.
 *
 * <p>The Reactor Context holds the id; MDC is written only around a single log call
 * and cleared right after, never left on a pooled thread.
 *
 * <pre>
 *     return SessionTrace.withSessionId(pipeline, SessionTrace.idFor(date));
 * </pre>
 */
public final class SessionTrace {

    public static final String SESSION_ID_KEY = "sessionId";

    private SessionTrace() {}

    /** {@code session-2026-03-02-5f3a1c}: readable date plus a short run discriminator. */
    public static String idFor(LocalDate date) {
        return "session-" + date + "-" + Long.toHexString(System.nanoTime() & 0xffffffL);
    }

    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** Never null; {@code "unknown"} outside a traced pipeline. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, "unknown");
    }

    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
