package com.workflowplatform.common.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/** Resource usage of one agent invocation plus any agent-defined counters. */
public record AgentMetrics(
    @JsonProperty("duration")   long duration,
    @JsonProperty("memoryUsed") long memoryUsed,
    @JsonProperty("cpuTime")    long cpuTime,
    @JsonProperty("custom")     Map<String, Object> custom
) {
    public static AgentMetrics empty() {
        return new AgentMetrics(0L, 0L, 0L, Map.of());
    }

    /** Flat map form persisted with the stage result. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("duration", duration);
        map.put("memoryUsed", memoryUsed);
        map.put("cpuTime", cpuTime);
        if (custom != null) {
            custom.forEach(map::putIfAbsent);
        }
        return map;
    }
}
