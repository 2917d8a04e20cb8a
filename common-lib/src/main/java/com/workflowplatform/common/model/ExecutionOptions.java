package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-run options for {@code executeWorkflow}.
 *
 * <p>{@code startFromAgent}/{@code stopAtAgent} select an inclusive slice of the sorted stages.
 * {@code timeoutSeconds} overrides the default per-stage timeout for this run only.
 * {@code retryOf} links a retry to the failed execution it replaces.
 */
public record ExecutionOptions(
    @JsonProperty("dryRun")         boolean dryRun,
    @JsonProperty("startFromAgent") String startFromAgent,
    @JsonProperty("stopAtAgent")    String stopAtAgent,
    @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
    @JsonProperty("retryOf")        String retryOf,
    @JsonProperty("triggerType")    TriggerType triggerType
) {
    public ExecutionOptions {
        triggerType = triggerType == null ? TriggerType.MANUAL : triggerType;
    }

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(false, null, null, null, null, TriggerType.MANUAL);
    }

    public ExecutionOptions withDryRun(boolean value) {
        return new ExecutionOptions(value, startFromAgent, stopAtAgent, timeoutSeconds, retryOf, triggerType);
    }

    public ExecutionOptions withStartFromAgent(String agentId) {
        return new ExecutionOptions(dryRun, agentId, stopAtAgent, timeoutSeconds, retryOf, triggerType);
    }

    public ExecutionOptions withStopAtAgent(String agentId) {
        return new ExecutionOptions(dryRun, startFromAgent, agentId, timeoutSeconds, retryOf, triggerType);
    }

    public ExecutionOptions withTimeoutSeconds(Integer seconds) {
        return new ExecutionOptions(dryRun, startFromAgent, stopAtAgent, seconds, retryOf, triggerType);
    }

    public ExecutionOptions withRetryOf(String executionId) {
        return new ExecutionOptions(dryRun, startFromAgent, stopAtAgent, timeoutSeconds, executionId, TriggerType.RETRY);
    }

    public ExecutionOptions withTriggerType(TriggerType type) {
        return new ExecutionOptions(dryRun, startFromAgent, stopAtAgent, timeoutSeconds, retryOf, type);
    }
}
