package com.workflowplatform.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workflowplatform.common.agent.AgentFactory;
import com.workflowplatform.common.agent.AgentProvider;
import com.workflowplatform.common.aggregation.ParallelAggregator;
import com.workflowplatform.common.decision.DecisionEngine;
import com.workflowplatform.common.validation.WorkflowValidator;
import com.workflowplatform.orchestrator.agent.RegistryAgentFactory;
import com.workflowplatform.orchestrator.gate.TradeMetricsExtractor;
import com.workflowplatform.orchestrator.risk.UserRiskStateStore;
import com.workflowplatform.orchestrator.service.ExecutorSettings;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${orchestrator.default-stage-timeout-seconds:300}")
    private long defaultStageTimeoutSeconds;

    @Value("${orchestrator.parallel.max-concurrency:10}")
    private int maxConcurrency;

    @Value("${orchestrator.risk.default-portfolio-value:10000}")
    private double defaultPortfolioValue;

    @Bean
    public DecisionEngine decisionEngine() {
        return new DecisionEngine();
    }

    @Bean
    public ParallelAggregator parallelAggregator() {
        return new ParallelAggregator();
    }

    @Bean
    public WorkflowValidator workflowValidator(DecisionEngine decisionEngine) {
        return new WorkflowValidator(decisionEngine);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UserRiskStateStore userRiskStateStore() {
        return new UserRiskStateStore();
    }

    @Bean
    public TradeMetricsExtractor tradeMetricsExtractor() {
        return new TradeMetricsExtractor(defaultPortfolioValue);
    }

    @Bean
    public ExecutorSettings executorSettings() {
        return new ExecutorSettings(Duration.ofSeconds(defaultStageTimeoutSeconds), maxConcurrency);
    }

    /** Agents are contributed as {@link AgentProvider} beans by whatever modules ship them. */
    @Bean
    public AgentFactory agentFactory(ObjectProvider<AgentProvider> providers) {
        return new RegistryAgentFactory(providers.orderedStream().toList());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
