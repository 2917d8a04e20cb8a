package com.workflowplatform.common.decision;

/**
 * Loose numeric coercion used by rule comparisons and trade metric extraction.
 * Numbers pass through, numeric strings are parsed, booleans map to 1/0.
 * Anything else is {@link Double#NaN}, which fails every ordered comparison.
 */
public final class NumberCoercion {

    private NumberCoercion() {}

    public static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (s.isEmpty()) {
                return Double.NaN;
            }
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static boolean isNumeric(Object value) {
        return !Double.isNaN(toDouble(value));
    }
}
