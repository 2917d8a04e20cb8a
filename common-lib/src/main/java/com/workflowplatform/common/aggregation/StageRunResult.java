package com.workflowplatform.common.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Settled outcome of one member of a parallel stage group. */
public record StageRunResult(
    @JsonProperty("agentId")   String agentId,
    @JsonProperty("stageType") String stageType,
    @JsonProperty("success")   boolean success,
    @JsonProperty("output")    Map<String, Object> output,
    @JsonProperty("error")     String error,
    @JsonProperty("startTime") Instant startTime,
    @JsonProperty("endTime")   Instant endTime
) {
    public static StageRunResult success(String agentId, String stageType, Map<String, Object> output,
                                         Instant startTime, Instant endTime) {
        return new StageRunResult(agentId, stageType, true, output, null, startTime, endTime);
    }

    public static StageRunResult failure(String agentId, String stageType, String error,
                                         Instant startTime, Instant endTime) {
        return new StageRunResult(agentId, stageType, false, null, error, startTime, endTime);
    }

    @JsonIgnore
    public long durationMs() {
        if (startTime == null || endTime == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(startTime, endTime).toMillis());
    }
}
