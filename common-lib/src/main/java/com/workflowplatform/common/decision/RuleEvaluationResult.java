package com.workflowplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workflowplatform.common.model.DecisionRule;

public record RuleEvaluationResult(
    @JsonProperty("rule")          DecisionRule rule,
    @JsonProperty("passed")        boolean passed,
    @JsonProperty("actualValue")   Object actualValue,
    @JsonProperty("expectedValue") Object expectedValue,
    @JsonProperty("error")         String error          // set when the rule could not be evaluated
) {}
