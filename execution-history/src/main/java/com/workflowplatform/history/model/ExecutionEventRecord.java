package com.workflowplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("execution_events")
public class ExecutionEventRecord {

    @Id
    private Long id;

    private Long executionId;

    /** Dotted wire name, e.g. {@code agent.completed} */
    private String eventType;

    private String agentId;

    /** JSON-serialised {@code Map<String, Object>} */
    private String data;

    /** UTC */
    private LocalDateTime occurredAt;
}
