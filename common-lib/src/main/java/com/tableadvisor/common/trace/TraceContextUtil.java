package com.tableadvisor.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the advisor session id through reactive pipelines and into log lines.
 *
 * <p>Reactor Context is where the session id lives inside a pipeline. MDC is written only
 * for the duration of a single log statement, never left behind on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withSessionId(pipeline, sessionId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";

    private TraceContextUtil() {}

    /**
     * Stores {@code sessionId} in the Reactor Context of {@code mono}. Since
     * {@code contextWrite} propagates upstream, call it last when assembling the pipeline.
     */
    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** Session id from the context, or {@code "unknown"}; never {@code null}. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, "unknown");
    }

    /**
     * Puts {@code sessionId} into MDC while {@code logAction} runs, then removes it.
     * Use only around log statements.
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
