package com.workflowplatform.common.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record DecisionResult(
    @JsonProperty("passed")      boolean passed,
    @JsonProperty("operator")    LogicalOperator operator,
    @JsonProperty("ruleResults") List<RuleEvaluationResult> ruleResults,
    @JsonProperty("evaluatedAt") Instant evaluatedAt,
    @JsonProperty("durationMs")  long durationMs
) {
    public long passedCount() {
        return ruleResults.stream().filter(RuleEvaluationResult::passed).count();
    }

    /** Human-readable list of failing rules, e.g. {@code price gt 100 (actual=90)}. */
    public String failureSummary() {
        return ruleResults.stream()
            .filter(r -> !r.passed())
            .map(r -> r.rule().field() + " " + r.rule().operator() + " " + r.expectedValue()
                + " (actual=" + r.actualValue() + (r.error() != null ? ", error=" + r.error() : "") + ")")
            .collect(Collectors.joining(", "));
    }
}
