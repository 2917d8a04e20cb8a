package com.workflowplatform.common.decision;

import com.workflowplatform.common.exception.UnknownOperatorException;

import java.util.Locale;

/** How rule outcomes combine: AND requires every rule, OR requires at least one. */
public enum LogicalOperator {
    AND,
    OR;

    /**
     * {@code null} defaults to {@link #AND}.
     *
     * @throws UnknownOperatorException for any other unrecognised value
     */
    public static LogicalOperator fromValue(String value) {
        if (value == null) {
            return AND;
        }
        try {
            return LogicalOperator.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownOperatorException(value);
        }
    }
}
