package com.workflowplatform.common.exception;

public class UnknownOperatorException extends ConfigurationException {
    private final String operator;

    public UnknownOperatorException(String operator) {
        super("Unknown operator: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
