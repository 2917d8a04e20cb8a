package com.workflowplatform.history.repository;

import com.workflowplatform.history.model.ExecutionEventRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ExecutionEventRecordRepository extends ReactiveCrudRepository<ExecutionEventRecord, Long> {

    Flux<ExecutionEventRecord> findByExecutionIdOrderByIdAsc(Long executionId);
}
