package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single comparison evaluated against stage output.
 *
 * <p>{@code operator} is kept as authored ({@code gt, gte, lt, lte, eq, ne, between}) so that
 * an unrecognised value can be reported by validation instead of failing deserialisation.
 * For {@code between} the value is a two-element list {@code [min, max]}.
 */
public record DecisionRule(
    @JsonProperty("field")       String field,
    @JsonProperty("operator")    String operator,
    @JsonProperty("value")       Object value,
    @JsonProperty("description") String description
) {
    public static DecisionRule of(String field, String operator, Object value) {
        return new DecisionRule(field, operator, value, null);
    }
}
