package com.workflowplatform.orchestrator.persistence;

import com.workflowplatform.common.model.AgentExecutionResult;
import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionStatus;
import com.workflowplatform.common.model.TriggerType;
import com.workflowplatform.common.model.WorkflowExecution;
import com.workflowplatform.common.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link ExecutionRepository}. Selected with {@code orchestrator.execution-store=memory};
 * also the store used by executor tests. Nothing survives a restart.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionRepository.class);

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, List<AgentExecutionResult>> results = new ConcurrentHashMap<>();
    private final Map<String, List<ExecutionEvent>> events = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExecutionRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<WorkflowExecution> createExecution(String workflowId, String triggeredBy, TriggerType triggerType,
                                                   Map<String, Object> metadata) {
        return Mono.fromCallable(() -> {
            String id = UUID.randomUUID().toString();
            WorkflowExecution execution = new WorkflowExecution(id, workflowId, ExecutionStatus.PENDING,
                triggeredBy, triggerType, clock.instant(), null, null, metadata, List.of());
            executions.put(id, execution);
            log.debug("Execution created. executionId={} workflowId={}", id, workflowId);
            return execution;
        });
    }

    @Override
    public Mono<WorkflowExecution> updateStatus(String executionId, ExecutionStatus status, String error) {
        return Mono.fromCallable(() -> executions.computeIfPresent(executionId, (id, current) -> current.withStatus(
            status,
            status.isTerminal() && current.endTime() == null ? clock.instant() : current.endTime(),
            error != null ? error : current.error())));
    }

    @Override
    public Mono<WorkflowExecution> findById(String executionId) {
        return Mono.fromCallable(() -> executions.get(executionId))
            .map(execution -> execution.withResults(sortedResults(executionId)));
    }

    @Override
    public Mono<AgentExecutionResult> createAgentResult(AgentExecutionResult result) {
        return Mono.fromCallable(() -> {
            AgentExecutionResult saved = result.withId(UUID.randomUUID().toString());
            results.computeIfAbsent(result.executionId(), id -> new CopyOnWriteArrayList<>()).add(saved);
            return saved;
        });
    }

    @Override
    public Flux<AgentExecutionResult> findAgentResultsByExecutionId(String executionId) {
        return Flux.defer(() -> Flux.fromIterable(sortedResults(executionId)));
    }

    @Override
    public Mono<ExecutionEvent> createEvent(ExecutionEvent event) {
        return Mono.fromCallable(() -> {
            ExecutionEvent saved = event.withId(UUID.randomUUID().toString());
            events.computeIfAbsent(event.executionId(), id -> new CopyOnWriteArrayList<>()).add(saved);
            return saved;
        });
    }

    @Override
    public Flux<ExecutionEvent> findEventsByExecutionId(String executionId) {
        return Flux.defer(() -> Flux.fromIterable(events.getOrDefault(executionId, List.of())));
    }

    private List<AgentExecutionResult> sortedResults(String executionId) {
        List<AgentExecutionResult> sorted = new ArrayList<>(results.getOrDefault(executionId, List.of()));
        sorted.sort(Comparator.comparingInt(AgentExecutionResult::orderIndex));
        return sorted;
    }
}
