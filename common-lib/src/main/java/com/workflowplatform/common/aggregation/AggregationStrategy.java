package com.workflowplatform.common.aggregation;

import com.workflowplatform.common.exception.ConfigurationException;

import java.util.Locale;

/**
 * How the outputs of a parallel MONITOR group are combined into one stage output.
 *
 * <ul>
 *   <li>{@link #FIRST}   : output of the first successful member in declared order.</li>
 *   <li>{@link #LAST}    : output of the last successful member in declared order.</li>
 *   <li>{@link #AVERAGE} : mean of every numeric field plus {@code _min}, {@code _max}, {@code _count}.</li>
 *   <li>{@link #WEIGHTED}: duration-weighted sum of every numeric field; faster members weigh more.</li>
 *   <li>{@link #MERGE}   : every output under {@code byAgent}, non-conflicting keys hoisted.</li>
 * </ul>
 */
public enum AggregationStrategy {
    FIRST,
    LAST,
    AVERAGE,
    WEIGHTED,
    MERGE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * {@code null} or blank defaults to {@link #MERGE}.
     *
     * @throws ConfigurationException for an unrecognised strategy name
     */
    public static AggregationStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MERGE;
        }
        try {
            return AggregationStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown aggregation strategy: " + value);
        }
    }
}
