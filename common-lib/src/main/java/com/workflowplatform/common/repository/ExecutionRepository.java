package com.workflowplatform.common.repository;

import com.workflowplatform.common.model.AgentExecutionResult;
import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionStatus;
import com.workflowplatform.common.model.TriggerType;
import com.workflowplatform.common.model.WorkflowExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Reactive store for executions, their per-stage results and lifecycle events.
 * Ids are assigned by the store.
 */
public interface ExecutionRepository {

    /** Creates a PENDING execution starting now. */
    Mono<WorkflowExecution> createExecution(String workflowId, String triggeredBy, TriggerType triggerType,
                                            Map<String, Object> metadata);

    /**
     * Moves an execution to {@code status}. Terminal statuses stamp the end time.
     * Empty when the execution does not exist.
     */
    Mono<WorkflowExecution> updateStatus(String executionId, ExecutionStatus status, String error);

    Mono<WorkflowExecution> findById(String executionId);

    Mono<AgentExecutionResult> createAgentResult(AgentExecutionResult result);

    /** Results ordered by {@code orderIndex}. */
    Flux<AgentExecutionResult> findAgentResultsByExecutionId(String executionId);

    Mono<ExecutionEvent> createEvent(ExecutionEvent event);

    /** Events in emission order. */
    Flux<ExecutionEvent> findEventsByExecutionId(String executionId);
}
