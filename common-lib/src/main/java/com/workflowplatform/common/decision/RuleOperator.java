package com.workflowplatform.common.decision;

import com.workflowplatform.common.exception.UnknownOperatorException;

import java.util.Locale;

/** Comparison applied by a {@link com.workflowplatform.common.model.DecisionRule}. */
public enum RuleOperator {
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    EQ("eq"),
    NE("ne"),
    BETWEEN("between");

    private final String value;

    RuleOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves an authored operator name, ignoring case.
     *
     * @throws UnknownOperatorException if {@code value} names no operator
     */
    public static RuleOperator fromValue(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (RuleOperator op : values()) {
                if (op.value.equals(normalised)) {
                    return op;
                }
            }
        }
        throw new UnknownOperatorException(value);
    }

    public static boolean isKnown(String value) {
        try {
            fromValue(value);
            return true;
        } catch (UnknownOperatorException e) {
            return false;
        }
    }
}
