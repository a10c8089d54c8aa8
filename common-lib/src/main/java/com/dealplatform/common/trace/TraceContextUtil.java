package com.dealplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the negotiation id through reactive pipelines.
 *
 * <p>The Reactor Context is the source of truth; MDC is written only for the duration of a
 * single log statement through {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withNegotiationId(pipeline, negotiationId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String NEGOTIATION_ID_KEY = "negotiationId";

    private TraceContextUtil() {}

    /** Stores the id in the Reactor Context; call at the end of pipeline assembly. */
    public static <T> Mono<T> withNegotiationId(Mono<T> mono, String negotiationId) {
        return mono.contextWrite(ctx -> ctx.put(NEGOTIATION_ID_KEY, negotiationId));
    }

    /** Never {@code null}; {@code "none"} when the pipeline carries no id. */
    public static String getNegotiationId(ContextView ctx) {
        return ctx.getOrDefault(NEGOTIATION_ID_KEY, "none");
    }

    public static void withMdc(String negotiationId, Runnable logAction) {
        MDC.put(NEGOTIATION_ID_KEY, negotiationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(NEGOTIATION_ID_KEY);
        }
    }
}
