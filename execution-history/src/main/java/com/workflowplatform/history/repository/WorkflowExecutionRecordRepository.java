package com.workflowplatform.history.repository;

import com.workflowplatform.history.model.WorkflowExecutionRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface WorkflowExecutionRecordRepository extends ReactiveCrudRepository<WorkflowExecutionRecord, Long> {

    @Query("""
        SELECT * FROM workflow_executions
        WHERE workflow_id = :workflowId
        ORDER BY start_time DESC
        LIMIT :limit
        """)
    Flux<WorkflowExecutionRecord> findRecentByWorkflowId(String workflowId, int limit);

    Flux<WorkflowExecutionRecord> findByStatus(String status);
}
