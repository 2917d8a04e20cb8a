package com.workflowplatform.history.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowplatform.common.model.AgentExecutionResult;
import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionEventType;
import com.workflowplatform.common.model.ExecutionStatus;
import com.workflowplatform.common.model.StageCategory;
import com.workflowplatform.common.model.StageResultStatus;
import com.workflowplatform.common.model.TriggerType;
import com.workflowplatform.common.model.WorkflowExecution;
import com.workflowplatform.common.repository.ExecutionRepository;
import com.workflowplatform.history.model.AgentResultRecord;
import com.workflowplatform.history.model.ExecutionEventRecord;
import com.workflowplatform.history.model.WorkflowExecutionRecord;
import com.workflowplatform.history.repository.AgentResultRecordRepository;
import com.workflowplatform.history.repository.ExecutionEventRecordRepository;
import com.workflowplatform.history.repository.WorkflowExecutionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * {@link ExecutionRepository} backed by Spring Data R2DBC.
 *
 * <p>Ids are database-generated {@code BIGINT}s exposed as decimal strings. An id that is not
 * a number cannot exist in this store, so lookups with one complete empty.
 * Map-valued fields are stored as JSON text columns; timestamps as UTC {@link LocalDateTime}.
 */
public class R2dbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(R2dbcExecutionRepository.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WorkflowExecutionRecordRepository executionRepository;
    private final AgentResultRecordRepository resultRepository;
    private final ExecutionEventRecordRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public R2dbcExecutionRepository(WorkflowExecutionRecordRepository executionRepository,
                                    AgentResultRecordRepository resultRepository,
                                    ExecutionEventRecordRepository eventRepository,
                                    ObjectMapper objectMapper,
                                    Clock clock) {
        this.executionRepository = executionRepository;
        this.resultRepository    = resultRepository;
        this.eventRepository     = eventRepository;
        this.objectMapper        = objectMapper;
        this.clock               = clock;
    }

    // ── Executions ──────────────────────────────────────────────────────────

    @Override
    public Mono<WorkflowExecution> createExecution(String workflowId, String triggeredBy,
                                                   TriggerType triggerType, Map<String, Object> metadata) {
        return Mono.fromCallable(() -> {
                WorkflowExecutionRecord record = new WorkflowExecutionRecord();
                record.setWorkflowId(workflowId);
                record.setStatus(ExecutionStatus.PENDING.name());
                record.setTriggeredBy(triggeredBy);
                record.setTriggerType(triggerType.name());
                record.setStartTime(toUtc(clock.instant()));
                record.setMetadata(writeJson(metadata));
                return record;
            })
            .flatMap(executionRepository::save)
            .map(saved -> toExecution(saved, List.of()))
            .doOnSuccess(e -> log.info("Execution created. executionId={} workflowId={} triggerType={}",
                e.id(), workflowId, triggerType))
            .doOnError(e -> log.error("Failed to create execution. workflowId={}", workflowId, e));
    }

    @Override
    public Mono<WorkflowExecution> updateStatus(String executionId, ExecutionStatus status, String error) {
        Long id = parseId(executionId);
        if (id == null) {
            return Mono.empty();
        }
        return executionRepository.findById(id)
            .flatMap(record -> {
                record.setStatus(status.name());
                if (error != null) {
                    record.setError(error);
                }
                if (status.isTerminal() && record.getEndTime() == null) {
                    record.setEndTime(toUtc(clock.instant()));
                }
                return executionRepository.save(record);
            })
            .map(saved -> toExecution(saved, List.of()))
            .doOnSuccess(e -> log.debug("Execution status updated. executionId={} status={}", executionId, status));
    }

    /** Loads the execution together with its stage results. */
    @Override
    public Mono<WorkflowExecution> findById(String executionId) {
        Long id = parseId(executionId);
        if (id == null) {
            return Mono.empty();
        }
        return executionRepository.findById(id)
            .flatMap(record -> findAgentResultsByExecutionId(executionId)
                .collectList()
                .map(results -> toExecution(record, results)));
    }

    // ── Stage results ───────────────────────────────────────────────────────

    @Override
    public Mono<AgentExecutionResult> createAgentResult(AgentExecutionResult result) {
        return Mono.fromCallable(() -> toRecord(result))
            .flatMap(resultRepository::save)
            .map(this::toResult);
    }

    @Override
    public Flux<AgentExecutionResult> findAgentResultsByExecutionId(String executionId) {
        Long id = parseId(executionId);
        if (id == null) {
            return Flux.empty();
        }
        return resultRepository.findByExecutionIdOrdered(id).map(this::toResult);
    }

    // ── Events ──────────────────────────────────────────────────────────────

    @Override
    public Mono<ExecutionEvent> createEvent(ExecutionEvent event) {
        return Mono.fromCallable(() -> {
                ExecutionEventRecord record = new ExecutionEventRecord();
                record.setExecutionId(requireId(event.executionId()));
                record.setEventType(event.eventType().value());
                record.setAgentId(event.agentId());
                record.setData(writeJson(event.data()));
                record.setOccurredAt(toUtc(event.timestamp() != null ? event.timestamp() : clock.instant()));
                return record;
            })
            .flatMap(eventRepository::save)
            .map(this::toEvent);
    }

    @Override
    public Flux<ExecutionEvent> findEventsByExecutionId(String executionId) {
        Long id = parseId(executionId);
        if (id == null) {
            return Flux.empty();
        }
        return eventRepository.findByExecutionIdOrderByIdAsc(id).map(this::toEvent);
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    private WorkflowExecution toExecution(WorkflowExecutionRecord r, List<AgentExecutionResult> results) {
        return new WorkflowExecution(
            String.valueOf(r.getId()),
            r.getWorkflowId(),
            ExecutionStatus.valueOf(r.getStatus()),
            r.getTriggeredBy(),
            r.getTriggerType() != null ? TriggerType.valueOf(r.getTriggerType()) : TriggerType.MANUAL,
            fromUtc(r.getStartTime()),
            fromUtc(r.getEndTime()),
            r.getError(),
            readJson(r.getMetadata()),
            results);
    }

    private AgentResultRecord toRecord(AgentExecutionResult result) {
        AgentResultRecord record = new AgentResultRecord();
        record.setExecutionId(requireId(result.executionId()));
        record.setAgentId(result.agentId());
        record.setStageType(result.stageType());
        record.setCategory(result.category() != null ? result.category().name() : null);
        record.setStatus(result.status().name());
        record.setOrderIndex(result.orderIndex());
        record.setInputData(writeJson(result.inputData()));
        record.setOutputData(writeJson(result.outputData()));
        record.setStartTime(toUtc(result.startTime()));
        record.setEndTime(toUtc(result.endTime()));
        record.setDurationMs(result.durationMs());
        record.setMetrics(writeJson(result.metrics()));
        record.setError(result.error());
        return record;
    }

    private AgentExecutionResult toResult(AgentResultRecord r) {
        return new AgentExecutionResult(
            String.valueOf(r.getId()),
            String.valueOf(r.getExecutionId()),
            r.getAgentId(),
            r.getStageType(),
            r.getCategory() != null ? StageCategory.valueOf(r.getCategory()) : null,
            StageResultStatus.valueOf(r.getStatus()),
            r.getOrderIndex(),
            readJson(r.getInputData()),
            readJson(r.getOutputData()),
            fromUtc(r.getStartTime()),
            fromUtc(r.getEndTime()),
            r.getDurationMs(),
            readJson(r.getMetrics()),
            r.getError());
    }

    private ExecutionEvent toEvent(ExecutionEventRecord r) {
        return new ExecutionEvent(
            String.valueOf(r.getId()),
            String.valueOf(r.getExecutionId()),
            ExecutionEventType.fromValue(r.getEventType()),
            r.getAgentId(),
            readJson(r.getData()),
            fromUtc(r.getOccurredAt()));
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise JSON column: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column, returning empty map. reason={}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static Long parseId(String id) {
        if (id == null) {
            return null;
        }
        try {
            return Long.valueOf(id);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long requireId(String id) {
        Long parsed = parseId(id);
        if (parsed == null) {
            throw new IllegalArgumentException("Not a persisted execution id: " + id);
        }
        return parsed;
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromUtc(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }
}
