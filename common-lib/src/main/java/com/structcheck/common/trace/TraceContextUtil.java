package com.structcheck.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the verification run id through reactive pipelines.
 *
 * <p>The Reactor Context holds the run id; MDC is written only for the duration of a
 * log statement, never kept as thread-local state.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(batch, runId);
 *     ...
 *     TraceContextUtil.withMdc(TraceContextUtil.getRunId(ctx), () -&gt; log.info(...));
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Stores the run id in the Reactor Context; call at the end of pipeline assembly. */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Run id from the context, {@value #UNKNOWN} when absent. Never null. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN);
    }

    /** Bridges the run id into MDC while {@code logAction} runs. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
