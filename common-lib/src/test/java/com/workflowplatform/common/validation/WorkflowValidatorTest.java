package com.workflowplatform.common.validation;

import com.workflowplatform.common.decision.DecisionEngine;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.model.DecisionConfig;
import com.workflowplatform.common.model.DecisionRule;
import com.workflowplatform.common.model.ErrorHandlingStrategy;
import com.workflowplatform.common.model.RiskControlConfig;
import com.workflowplatform.common.model.StageCategory;
import com.workflowplatform.common.model.StageConfig;
import com.workflowplatform.common.model.StageNode;
import com.workflowplatform.common.model.Workflow;
import com.workflowplatform.common.model.WorkflowSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowValidatorTest {

    private final WorkflowValidator validator = new WorkflowValidator(new DecisionEngine());

    private static StageNode stage(String id, StageCategory category, int order) {
        return new StageNode(id, "noop", category, order, null);
    }

    @Test
    @DisplayName("a well-formed trading workflow has no errors")
    void validWorkflow() {
        Workflow workflow = new Workflow("wf-1", "trend", List.of(
            stage("m1", StageCategory.MONITOR, 1),
            stage("a1", StageCategory.ANALYZE, 2),
            stage("e1", StageCategory.EXECUTE, 3)),
            new WorkflowSettings(60, ErrorHandlingStrategy.STOP, new RiskControlConfig(5, 10, 3, 300, 2)),
            DecisionConfig.of("AND", DecisionRule.of("confidence", "gte", 0.7)));

        assertTrue(validator.validate(workflow).isEmpty());
        assertDoesNotThrow(() -> validator.requireValid(workflow));
    }

    @Test
    @DisplayName("empty workflow is rejected")
    void emptyWorkflow() {
        List<String> errors = validator.validate(new Workflow("wf", "empty", List.of(), null, null));
        assertEquals(List.of("Workflow must have at least one stage"), errors);
    }

    @Test
    @DisplayName("structural problems are all collected")
    void structuralErrors() {
        Workflow workflow = new Workflow("wf", "broken", List.of(
            stage("s1", StageCategory.COLLECT, 1),
            stage("s1", StageCategory.PROCESS, 2),
            new StageNode("m1", " ", StageCategory.MONITOR, 3,
                StageConfig.of(StageCategory.MONITOR, Map.of("aggregationStrategy", "median"))),
            new StageNode("p1", "noop", StageCategory.PUBLISH, 4,
                StageConfig.of(StageCategory.COLLECT, Map.of("timeoutSeconds", 0)))),
            new WorkflowSettings(0, null, new RiskControlConfig(0, 10, 0, 300, 2)),
            DecisionConfig.of("AND", DecisionRule.of("x", "approx", 1)));

        List<String> errors = validator.validate(workflow);

        assertTrue(errors.contains("Duplicate stage id: s1"));
        assertTrue(errors.contains("Stage m1: stageType is required"));
        assertTrue(errors.contains("Stage m1: Unknown aggregation strategy: median"));
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("Stage p1: config category")));
        assertTrue(errors.contains("Stage p1: timeoutSeconds must be positive"));
        assertTrue(errors.contains("executionTimeoutSeconds must be positive"));
        assertTrue(errors.contains("Risk controls: maxPositionSize must be positive"));
        assertTrue(errors.contains("Risk controls: maxConcurrentTrades must be positive"));
        assertTrue(errors.contains("Decision config: Rule 0: invalid operator 'approx'"));
        assertEquals(9, errors.size());
    }

    @Test
    @DisplayName("requireValid raises ConfigurationException carrying every error")
    void requireValidThrows() {
        Workflow workflow = new Workflow("wf", "dup", List.of(
            stage("s1", StageCategory.COLLECT, 1),
            stage("s1", StageCategory.COLLECT, 2)), null, null);

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> validator.requireValid(workflow));
        assertEquals(List.of("Duplicate stage id: s1"), ex.getErrors());
    }
}
