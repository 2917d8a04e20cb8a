package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One stage of a workflow. {@code stageType} names the agent implementation;
 * {@code order} defines the position in the run.
 */
public record StageNode(
    @JsonProperty("id")        String id,
    @JsonProperty("stageType") String stageType,
    @JsonProperty("category")  StageCategory category,
    @JsonProperty("order")     int order,
    @JsonProperty("config")    StageConfig config
) {
    /** Config to hand to the agent; an empty one of the node's category when none was authored. */
    @JsonIgnore
    public StageConfig effectiveConfig() {
        return config != null ? config : StageConfig.of(category);
    }
}
