package com.workflowplatform.common.exception;

public class ExecutionNotFoundException extends WorkflowException {
    public ExecutionNotFoundException(String executionId) {
        super(executionId, "Execution " + executionId + " not found");
    }
}
