package com.workflowplatform.common.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * What an agent receives for one invocation: the previous stage's output plus
 * enough context to correlate logs with the owning execution.
 */
public record AgentInput(
    @JsonProperty("executionId") String executionId,
    @JsonProperty("stageId")     String stageId,
    @JsonProperty("userId")      String userId,
    @JsonProperty("data")        Map<String, Object> data
) {
    public AgentInput {
        data = data == null ? Map.of() : data;
    }
}
