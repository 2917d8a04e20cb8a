package com.workflowplatform.common.model;

public enum StageResultStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
