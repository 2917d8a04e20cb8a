package com.workflowplatform.common.validation;

import com.workflowplatform.common.aggregation.AggregationStrategy;
import com.workflowplatform.common.decision.DecisionEngine;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.model.RiskControlConfig;
import com.workflowplatform.common.model.StageCategory;
import com.workflowplatform.common.model.StageConfig;
import com.workflowplatform.common.model.StageNode;
import com.workflowplatform.common.model.Workflow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks run once when a workflow is loaded and again before every execution.
 * Collects every problem rather than stopping at the first.
 */
public class WorkflowValidator {

    private final DecisionEngine decisionEngine;

    public WorkflowValidator(DecisionEngine decisionEngine) {
        this.decisionEngine = decisionEngine;
    }

    public List<String> validate(Workflow workflow) {
        List<String> errors = new ArrayList<>();
        if (workflow.stages().isEmpty()) {
            errors.add("Workflow must have at least one stage");
        }

        Set<String> ids = new HashSet<>();
        for (StageNode node : workflow.stages()) {
            String label = node.id() == null || node.id().isBlank() ? "<unnamed>" : node.id();
            if (node.id() == null || node.id().isBlank()) {
                errors.add("Stage id is required");
            } else if (!ids.add(node.id())) {
                errors.add("Duplicate stage id: " + node.id());
            }
            if (node.stageType() == null || node.stageType().isBlank()) {
                errors.add("Stage " + label + ": stageType is required");
            }
            if (node.category() == null) {
                errors.add("Stage " + label + ": category is required");
            }
            validateStageConfig(label, node, errors);
        }

        if (workflow.decisionConfig() != null) {
            decisionEngine.validateConfig(workflow.decisionConfig())
                .forEach(e -> errors.add("Decision config: " + e));
        }

        Integer executionTimeout = workflow.settings().executionTimeoutSeconds();
        if (executionTimeout != null && executionTimeout <= 0) {
            errors.add("executionTimeoutSeconds must be positive");
        }
        RiskControlConfig risk = workflow.settings().riskControls();
        if (risk != null) {
            if (risk.maxPositionSize() <= 0) {
                errors.add("Risk controls: maxPositionSize must be positive");
            }
            if (risk.maxDailyLoss() <= 0) {
                errors.add("Risk controls: maxDailyLoss must be positive");
            }
            if (risk.maxConcurrentTrades() <= 0) {
                errors.add("Risk controls: maxConcurrentTrades must be positive");
            }
            if (risk.cooldownPeriod() < 0) {
                errors.add("Risk controls: cooldownPeriod must not be negative");
            }
            if (risk.maxLossPerTrade() <= 0) {
                errors.add("Risk controls: maxLossPerTrade must be positive");
            }
        }
        return errors;
    }

    /** @throws ConfigurationException listing every problem found */
    public void requireValid(Workflow workflow) {
        List<String> errors = validate(workflow);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid workflow " + workflow.id(), errors);
        }
    }

    private static void validateStageConfig(String label, StageNode node, List<String> errors) {
        StageConfig config = node.config();
        if (config == null) {
            return;
        }
        if (config.category() != null && node.category() != null && config.category() != node.category()) {
            errors.add("Stage " + label + ": config category " + config.category()
                + " does not match stage category " + node.category());
        }
        if (node.category() == StageCategory.MONITOR) {
            try {
                AggregationStrategy.fromValue(config.aggregationStrategy());
            } catch (ConfigurationException e) {
                errors.add("Stage " + label + ": " + e.getMessage());
            }
        }
        try {
            Integer timeout = config.timeoutSeconds();
            if (timeout != null && timeout <= 0) {
                errors.add("Stage " + label + ": timeoutSeconds must be positive");
            }
        } catch (IllegalArgumentException e) {
            errors.add("Stage " + label + ": " + e.getMessage());
        }
    }
}
