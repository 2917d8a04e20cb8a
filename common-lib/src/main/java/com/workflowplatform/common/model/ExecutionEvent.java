package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ExecutionEvent(
    @JsonProperty("id")          String id,
    @JsonProperty("executionId") String executionId,
    @JsonProperty("eventType")   ExecutionEventType eventType,
    @JsonProperty("agentId")     String agentId,
    @JsonProperty("data")        Map<String, Object> data,
    @JsonProperty("timestamp")   Instant timestamp
) {
    public static ExecutionEvent of(String executionId, ExecutionEventType type, String agentId,
                                    Map<String, Object> data, Instant timestamp) {
        return new ExecutionEvent(null, executionId, type, agentId, data == null ? Map.of() : data, timestamp);
    }

    public ExecutionEvent withId(String newId) {
        return new ExecutionEvent(newId, executionId, eventType, agentId, data, timestamp);
    }
}
