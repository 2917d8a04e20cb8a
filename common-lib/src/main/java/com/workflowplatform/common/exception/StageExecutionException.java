package com.workflowplatform.common.exception;

import java.time.Instant;

/**
 * A stage's agent failed. Start and end time are kept so the failed result
 * can be persisted with the real timing of the attempt.
 */
public class StageExecutionException extends WorkflowException {
    private final String stageId;
    private final Instant startTime;
    private final Instant endTime;

    public StageExecutionException(String stageId, String message, Instant startTime, Instant endTime,
                                   Throwable cause) {
        super(null, "[" + stageId + "] " + message, cause);
        this.stageId = stageId;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getStageId() {
        return stageId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }
}
