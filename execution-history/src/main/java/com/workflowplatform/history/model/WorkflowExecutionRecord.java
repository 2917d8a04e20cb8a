package com.workflowplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted workflow execution.
 *
 * Column mapping (R2DBC snake_case convention):
 *   workflowId  → workflow_id
 *   triggeredBy → triggered_by
 *   triggerType → trigger_type
 *   startTime   → start_time
 *   endTime     → end_time
 *
 * metadata: JSON-serialised Map<String, Object> (dryRun, options, retryOf)
 */
@Data
@NoArgsConstructor
@Table("workflow_executions")
public class WorkflowExecutionRecord {

    @Id
    private Long id;

    private String workflowId;

    /** Enum name of {@link com.workflowplatform.common.model.ExecutionStatus} */
    private String status;

    private String triggeredBy;

    private String triggerType;

    /** UTC */
    private LocalDateTime startTime;

    /** UTC; null until the execution reaches a terminal status */
    private LocalDateTime endTime;

    private String error;

    /** JSON-serialised {@code Map<String, Object>} */
    private String metadata;
}
