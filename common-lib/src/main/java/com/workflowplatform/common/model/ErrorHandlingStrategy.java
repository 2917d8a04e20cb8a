package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * What the executor does when a sequential stage fails.
 *
 * <ul>
 *   <li>{@link #STOP}    : fail the whole execution.</li>
 *   <li>{@link #SKIP}    : record the failure and move on to the next stage.</li>
 *   <li>{@link #CONTINUE}: same as SKIP; kept as a distinct value for authored workflows.</li>
 * </ul>
 */
public enum ErrorHandlingStrategy {
    STOP,
    SKIP,
    CONTINUE;

    @JsonCreator
    public static ErrorHandlingStrategy fromValue(String value) {
        if (value == null) {
            return STOP;
        }
        return ErrorHandlingStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
