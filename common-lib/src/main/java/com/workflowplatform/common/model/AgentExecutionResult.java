package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted outcome of one stage within an execution.
 * {@code id} is {@code null} until the repository assigns one.
 */
public record AgentExecutionResult(
    @JsonProperty("id")          String id,
    @JsonProperty("executionId") String executionId,
    @JsonProperty("agentId")     String agentId,
    @JsonProperty("stageType")   String stageType,
    @JsonProperty("category")    StageCategory category,
    @JsonProperty("status")      StageResultStatus status,
    @JsonProperty("orderIndex")  int orderIndex,
    @JsonProperty("inputData")   Map<String, Object> inputData,
    @JsonProperty("outputData")  Map<String, Object> outputData,
    @JsonProperty("startTime")   Instant startTime,
    @JsonProperty("endTime")     Instant endTime,
    @JsonProperty("durationMs")  long durationMs,
    @JsonProperty("metrics")     Map<String, Object> metrics,
    @JsonProperty("error")       String error
) {
    public AgentExecutionResult withId(String newId) {
        return new AgentExecutionResult(newId, executionId, agentId, stageType, category, status,
            orderIndex, inputData, outputData, startTime, endTime, durationMs, metrics, error);
    }
}
