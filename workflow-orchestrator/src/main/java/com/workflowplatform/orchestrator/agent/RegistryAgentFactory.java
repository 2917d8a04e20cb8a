package com.workflowplatform.orchestrator.agent;

import com.workflowplatform.common.agent.Agent;
import com.workflowplatform.common.agent.AgentFactory;
import com.workflowplatform.common.agent.AgentProvider;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.model.StageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link AgentFactory} over every {@link AgentProvider} bean in the context.
 * A stage type may be registered only once.
 */
public class RegistryAgentFactory implements AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(RegistryAgentFactory.class);

    private final Map<String, AgentProvider> providers;

    public RegistryAgentFactory(List<AgentProvider> providers) {
        Map<String, AgentProvider> byType = new LinkedHashMap<>();
        for (AgentProvider provider : providers) {
            AgentProvider existing = byType.putIfAbsent(provider.stageType(), provider);
            if (existing != null) {
                throw new ConfigurationException("Duplicate agent provider for stageType=" + provider.stageType()
                    + ": " + existing.getClass().getName() + ", " + provider.getClass().getName());
            }
        }
        this.providers = Collections.unmodifiableMap(byType);
        log.info("Agent registry initialised. stageTypes={}", this.providers.keySet());
    }

    @Override
    public Agent createAgent(String stageType, StageConfig config) {
        AgentProvider provider = providers.get(stageType);
        if (provider == null) {
            throw new ConfigurationException("No agent registered for stageType=" + stageType);
        }
        return provider.create(config);
    }

    public Set<String> registeredStageTypes() {
        return providers.keySet();
    }
}
