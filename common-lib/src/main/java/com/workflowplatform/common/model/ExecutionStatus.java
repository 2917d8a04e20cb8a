package com.workflowplatform.common.model;

/** Lifecycle of a workflow execution: PENDING → RUNNING → COMPLETED | FAILED | CANCELLED. */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
