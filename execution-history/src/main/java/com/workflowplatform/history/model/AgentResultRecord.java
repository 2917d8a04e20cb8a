package com.workflowplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted outcome of one stage within an execution.
 *
 * inputData / outputData / metrics: JSON-serialised Map<String, Object>
 */
@Data
@NoArgsConstructor
@Table("agent_execution_results")
public class AgentResultRecord {

    @Id
    private Long id;

    private Long executionId;

    private String agentId;

    private String stageType;

    private String category;

    /** SUCCESS / FAILED / SKIPPED */
    private String status;

    private int orderIndex;

    private String inputData;

    private String outputData;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private long durationMs;

    private String metrics;

    private String error;
}
