package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record WorkflowExecution(
    @JsonProperty("id")          String id,
    @JsonProperty("workflowId")  String workflowId,
    @JsonProperty("status")      ExecutionStatus status,
    @JsonProperty("triggeredBy") String triggeredBy,
    @JsonProperty("triggerType") TriggerType triggerType,
    @JsonProperty("startTime")   Instant startTime,
    @JsonProperty("endTime")     Instant endTime,
    @JsonProperty("error")       String error,
    @JsonProperty("metadata")    Map<String, Object> metadata,
    @JsonProperty("results")     List<AgentExecutionResult> results
) {
    public WorkflowExecution {
        metadata = metadata == null ? Map.of() : metadata;
        results  = results == null ? List.of() : List.copyOf(results);
    }

    public WorkflowExecution withResults(List<AgentExecutionResult> newResults) {
        return new WorkflowExecution(id, workflowId, status, triggeredBy, triggerType,
            startTime, endTime, error, metadata, newResults);
    }

    public WorkflowExecution withStatus(ExecutionStatus newStatus, Instant newEndTime, String newError) {
        return new WorkflowExecution(id, workflowId, newStatus, triggeredBy, triggerType,
            startTime, newEndTime, newError, metadata, results);
    }
}
