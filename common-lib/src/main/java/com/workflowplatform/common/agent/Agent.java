package com.workflowplatform.common.agent;

import java.util.Map;

/**
 * A unit of work bound to one workflow stage.
 *
 * <p>Agents are created per invocation by an {@link AgentFactory}. {@link #execute} is allowed
 * to block; the runner always calls it off the event loop. {@link #cleanup()} is called exactly
 * once after every invocation, whether it succeeded, failed, timed out or was cancelled.
 */
public interface Agent {

    Map<String, Object> execute(AgentInput input) throws Exception;

    default void cleanup() {}

    default AgentMetrics getMetrics() {
        return AgentMetrics.empty();
    }
}
