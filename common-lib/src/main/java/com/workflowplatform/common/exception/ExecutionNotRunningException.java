package com.workflowplatform.common.exception;

public class ExecutionNotRunningException extends WorkflowException {
    public ExecutionNotRunningException(String executionId) {
        super(executionId, "Execution " + executionId + " is not running");
    }
}
