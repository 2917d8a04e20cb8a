package com.workflowplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Propagates the execution id through reactive pipelines for log correlation.
 *
 * <p>Reactor Context holds the execution id inside a pipeline. MDC is only written
 * for the duration of a single log statement through {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withExecutionId(pipeline, executionId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String EXECUTION_ID_KEY = "executionId";

    private TraceContextUtil() {}

    /**
     * Stores {@code executionId} in the Reactor Context of {@code mono}.
     * Call at the end of pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withExecutionId(Mono<T> mono, String executionId) {
        return mono.contextWrite(ctx -> ctx.put(EXECUTION_ID_KEY, executionId));
    }

    /** Returns {@code "unknown"} if not present, never {@code null}. */
    public static String getExecutionId(ContextView ctx) {
        return ctx.getOrDefault(EXECUTION_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code executionId} into MDC while {@code logAction} runs, then removes it.
     * Only use inside logging side-effects.
     */
    public static void withMdc(String executionId, Runnable logAction) {
        MDC.put(EXECUTION_ID_KEY, executionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(EXECUTION_ID_KEY);
        }
    }
}
