package com.workflowplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowplatform.common.repository.ExecutionRepository;
import com.workflowplatform.history.repository.AgentResultRecordRepository;
import com.workflowplatform.history.repository.ExecutionEventRecordRepository;
import com.workflowplatform.history.repository.WorkflowExecutionRecordRepository;
import com.workflowplatform.history.service.R2dbcExecutionRepository;
import com.workflowplatform.orchestrator.persistence.InMemoryExecutionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

import java.time.Clock;

/**
 * Chooses the {@link ExecutionRepository} with {@code orchestrator.execution-store}:
 * {@code r2dbc} (default) or {@code memory}.
 */
@Configuration
public class ExecutionStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "orchestrator.execution-store", havingValue = "memory")
    public ExecutionRepository inMemoryExecutionRepository(Clock clock) {
        return new InMemoryExecutionRepository(clock);
    }

    @Configuration
    @ConditionalOnProperty(name = "orchestrator.execution-store", havingValue = "r2dbc", matchIfMissing = true)
    @EnableR2dbcRepositories(basePackages = "com.workflowplatform.history.repository")
    static class R2dbcStoreConfig {

        @Bean
        public ExecutionRepository r2dbcExecutionRepository(WorkflowExecutionRecordRepository executions,
                                                            AgentResultRecordRepository results,
                                                            ExecutionEventRecordRepository events,
                                                            ObjectMapper objectMapper,
                                                            Clock clock) {
            return new R2dbcExecutionRepository(executions, results, events, objectMapper, clock);
        }
    }
}
