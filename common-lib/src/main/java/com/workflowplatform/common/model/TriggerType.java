package com.workflowplatform.common.model;

public enum TriggerType {
    MANUAL,
    SCHEDULED,
    WEBHOOK,
    RETRY
}
