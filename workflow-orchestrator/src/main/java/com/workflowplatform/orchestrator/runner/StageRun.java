package com.workflowplatform.orchestrator.runner;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Successful invocation of one stage's agent. */
public record StageRun(
    String stageId,
    Map<String, Object> output,
    Map<String, Object> metrics,
    Instant startTime,
    Instant endTime
) {
    public long durationMs() {
        return Duration.between(startTime, endTime).toMillis();
    }
}
