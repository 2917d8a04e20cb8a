package com.workflowplatform.common.exception;

/**
 * Base of every error raised by the workflow platform.
 * Carries the execution id when the failure belongs to a specific run.
 */
public class WorkflowException extends RuntimeException {
    private final String executionId;

    public WorkflowException(String message) {
        this(null, message, null);
    }

    public WorkflowException(String executionId, String message) {
        this(executionId, message, null);
    }

    public WorkflowException(String executionId, String message, Throwable cause) {
        super(message, cause);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
