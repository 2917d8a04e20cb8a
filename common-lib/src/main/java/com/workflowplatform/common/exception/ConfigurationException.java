package com.workflowplatform.common.exception;

import java.util.List;

/** Workflow definition or run options are invalid; raised before anything is persisted. */
public class ConfigurationException extends WorkflowException {
    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, List<String> errors) {
        super(message + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
