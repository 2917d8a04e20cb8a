package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

public record Workflow(
    @JsonProperty("id")             String id,
    @JsonProperty("name")           String name,
    @JsonProperty("stages")         List<StageNode> stages,
    @JsonProperty("settings")       WorkflowSettings settings,
    @JsonProperty("decisionConfig") DecisionConfig decisionConfig
) {
    public Workflow {
        stages   = stages == null ? List.of() : List.copyOf(stages);
        settings = settings == null ? WorkflowSettings.defaults() : settings;
    }

    /** Stages in ascending {@code order}; ties keep their authored position. */
    @JsonIgnore
    public List<StageNode> sortedStages() {
        return stages.stream()
            .sorted(Comparator.comparingInt(StageNode::order))
            .toList();
    }
}
