package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a workflow stage. Drives how the executor schedules the stage.
 *
 * <ul>
 *   <li>{@link #MONITOR} : contiguous runs are dispatched in parallel and aggregated.</li>
 *   <li>{@link #ANALYZE} : output feeds the decision/risk gate of a following EXECUTE stage.</li>
 *   <li>{@link #EXECUTE} : gated; skipped when the decision or risk check blocks.</li>
 *   <li>{@link #VERIFY}  : output carries the realised P&amp;L recorded against the user's risk state.</li>
 * </ul>
 *
 * <p>{@link #COLLECT}, {@link #PROCESS}, {@link #PUBLISH} and {@link #VALIDATE} are plain sequential stages.
 */
public enum StageCategory {
    COLLECT,
    PROCESS,
    PUBLISH,
    VALIDATE,
    MONITOR,
    ANALYZE,
    EXECUTE,
    VERIFY;

    /** Accepts any casing; the legacy {@code work} category maps to {@link #COLLECT}. */
    @JsonCreator
    public static StageCategory fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage category must not be null");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        if ("WORK".equals(normalised)) {
            return COLLECT;
        }
        return StageCategory.valueOf(normalised);
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
