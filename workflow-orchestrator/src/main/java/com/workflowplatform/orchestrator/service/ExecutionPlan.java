package com.workflowplatform.orchestrator.service;

import com.workflowplatform.common.model.ExecutionOptions;
import com.workflowplatform.common.model.StageNode;
import com.workflowplatform.common.model.Workflow;

import java.util.List;

/** Validated workflow plus the inclusive slice {@code [startIndex, endIndex]} of its sorted stages to run. */
record ExecutionPlan(
    Workflow workflow,
    List<StageNode> stages,
    int startIndex,
    int endIndex,
    ExecutionOptions options
) {
    StageNode stage(int index) {
        return stages.get(index);
    }
}
