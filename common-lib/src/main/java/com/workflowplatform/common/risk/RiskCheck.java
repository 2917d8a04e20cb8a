package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskCheck(
    @JsonProperty("type")         RiskCheckType type,
    @JsonProperty("passed")       boolean passed,
    @JsonProperty("reason")       String reason,
    @JsonProperty("currentValue") Double currentValue,
    @JsonProperty("limitValue")   Double limitValue,
    @JsonProperty("severity")     RiskSeverity severity
) {}
