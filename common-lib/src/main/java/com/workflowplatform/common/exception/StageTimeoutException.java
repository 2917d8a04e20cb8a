package com.workflowplatform.common.exception;

import java.time.Duration;
import java.time.Instant;

public class StageTimeoutException extends StageExecutionException {
    private final Duration timeout;

    public StageTimeoutException(String stageId, Duration timeout, Instant startTime, Instant endTime) {
        super(stageId, "Agent execution timeout after " + timeout.toMillis() + "ms", startTime, endTime, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
