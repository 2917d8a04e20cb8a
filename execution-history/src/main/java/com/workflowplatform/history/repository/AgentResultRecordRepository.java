package com.workflowplatform.history.repository;

import com.workflowplatform.history.model.AgentResultRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AgentResultRecordRepository extends ReactiveCrudRepository<AgentResultRecord, Long> {

    /** Ties on order_index (parallel group members) keep insertion order. */
    @Query("""
        SELECT * FROM agent_execution_results
        WHERE execution_id = :executionId
        ORDER BY order_index ASC, id ASC
        """)
    Flux<AgentResultRecord> findByExecutionIdOrdered(Long executionId);
}
