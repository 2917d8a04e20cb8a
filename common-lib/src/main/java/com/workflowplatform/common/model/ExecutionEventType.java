package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle event emitted by the executor; serialised with its dotted wire name. */
public enum ExecutionEventType {
    EXECUTION_STARTED("execution.started"),
    EXECUTION_COMPLETED("execution.completed"),
    EXECUTION_FAILED("execution.failed"),
    EXECUTION_CANCELLED("execution.cancelled"),
    AGENT_STARTED("agent.started"),
    AGENT_PROGRESS("agent.progress"),
    AGENT_COMPLETED("agent.completed"),
    AGENT_FAILED("agent.failed"),
    AGENT_SKIPPED("agent.skipped");

    private final String value;

    ExecutionEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExecutionEventType fromValue(String value) {
        for (ExecutionEventType type : values()) {
            if (type.value.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown execution event type: " + value);
    }
}
