package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkflowSettings(
    @JsonProperty("executionTimeoutSeconds") Integer executionTimeoutSeconds,
    @JsonProperty("errorHandling")           ErrorHandlingStrategy errorHandling,
    @JsonProperty("riskControls")            RiskControlConfig riskControls
) {
    public WorkflowSettings {
        errorHandling = errorHandling == null ? ErrorHandlingStrategy.STOP : errorHandling;
    }

    public static WorkflowSettings defaults() {
        return new WorkflowSettings(null, ErrorHandlingStrategy.STOP, null);
    }

    public static WorkflowSettings of(ErrorHandlingStrategy errorHandling) {
        return new WorkflowSettings(null, errorHandling, null);
    }
}
