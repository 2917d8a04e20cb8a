package com.workflowplatform.common.agent;

import com.workflowplatform.common.model.StageConfig;

/**
 * Registers one agent implementation under a stage type.
 * A registry-backed {@link AgentFactory} collects every provider on the classpath.
 */
public interface AgentProvider {

    String stageType();

    Agent create(StageConfig config);
}
