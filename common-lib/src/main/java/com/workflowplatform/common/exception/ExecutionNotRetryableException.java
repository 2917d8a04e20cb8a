package com.workflowplatform.common.exception;

import com.workflowplatform.common.model.ExecutionStatus;

public class ExecutionNotRetryableException extends WorkflowException {
    private final ExecutionStatus status;

    public ExecutionNotRetryableException(String executionId, ExecutionStatus status) {
        super(executionId, "Can only retry failed executions. executionId=" + executionId + " status=" + status);
        this.status = status;
    }

    public ExecutionStatus getStatus() {
        return status;
    }
}
