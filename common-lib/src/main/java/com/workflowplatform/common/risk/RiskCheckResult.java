package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/** {@code allowed} only when every check passed; {@code warnings} lists passing near-miss checks. */
public record RiskCheckResult(
    @JsonProperty("allowed")   boolean allowed,
    @JsonProperty("checks")    List<RiskCheck> checks,
    @JsonProperty("warnings")  List<String> warnings,
    @JsonProperty("timestamp") Instant timestamp
) {
    public String failureSummary() {
        return checks.stream()
            .filter(c -> !c.passed())
            .map(c -> c.type().value() + ": " + c.reason())
            .collect(Collectors.joining("; "));
    }
}
