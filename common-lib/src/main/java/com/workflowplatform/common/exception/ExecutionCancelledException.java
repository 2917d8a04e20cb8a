package com.workflowplatform.common.exception;

public class ExecutionCancelledException extends WorkflowException {
    public ExecutionCancelledException(String executionId) {
        super(executionId, "Execution cancelled: " + executionId);
    }
}
