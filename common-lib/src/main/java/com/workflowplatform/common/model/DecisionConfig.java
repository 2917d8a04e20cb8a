package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Rules combined with {@code AND} (every rule) or {@code OR} (at least one rule). */
public record DecisionConfig(
    @JsonProperty("rules")       List<DecisionRule> rules,
    @JsonProperty("operator")    String operator,
    @JsonProperty("description") String description
) {
    public DecisionConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static DecisionConfig of(String operator, DecisionRule... rules) {
        return new DecisionConfig(List.of(rules), operator, null);
    }
}
