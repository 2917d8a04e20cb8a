package com.workflowplatform.common.agent;

import com.workflowplatform.common.model.StageConfig;

public interface AgentFactory {

    /**
     * @throws com.workflowplatform.common.exception.ConfigurationException if no agent
     *         is registered for {@code stageType}
     */
    Agent createAgent(String stageType, StageConfig config);
}
