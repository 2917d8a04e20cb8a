package com.workflowplatform.orchestrator.service;

import com.workflowplatform.common.agent.AgentInput;
import com.workflowplatform.common.aggregation.AggregationStrategy;
import com.workflowplatform.common.aggregation.ParallelAggregator;
import com.workflowplatform.common.aggregation.StageRunResult;
import com.workflowplatform.common.event.ExecutionEventPublisher;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.exception.ExecutionCancelledException;
import com.workflowplatform.common.exception.ExecutionNotFoundException;
import com.workflowplatform.common.exception.ExecutionNotRetryableException;
import com.workflowplatform.common.exception.ExecutionNotRunningException;
import com.workflowplatform.common.exception.StageExecutionException;
import com.workflowplatform.common.model.AgentExecutionResult;
import com.workflowplatform.common.model.ErrorHandlingStrategy;
import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionEventType;
import com.workflowplatform.common.model.ExecutionOptions;
import com.workflowplatform.common.model.ExecutionStatus;
import com.workflowplatform.common.model.StageCategory;
import com.workflowplatform.common.model.StageNode;
import com.workflowplatform.common.model.StageResultStatus;
import com.workflowplatform.common.model.Workflow;
import com.workflowplatform.common.model.WorkflowExecution;
import com.workflowplatform.common.repository.ExecutionRepository;
import com.workflowplatform.common.trace.TraceContextUtil;
import com.workflowplatform.common.validation.WorkflowValidator;
import com.workflowplatform.orchestrator.gate.ExecutionGate;
import com.workflowplatform.orchestrator.gate.GateDecision;
import com.workflowplatform.orchestrator.gate.TradeMetricsExtractor;
import com.workflowplatform.orchestrator.risk.RiskGate;
import com.workflowplatform.orchestrator.runner.AgentRunner;
import com.workflowplatform.orchestrator.runner.StageRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs workflows stage by stage.
 *
 * <h3>Scheduling</h3>
 * <ul>
 *   <li>Stages run in ascending {@code order}; each stage receives the previous stage's output
 *       (COLLECT stages receive an empty input).</li>
 *   <li>A contiguous run of MONITOR stages is dispatched concurrently; the group's settled
 *       results are aggregated into one output with the first member's strategy.</li>
 *   <li>An ANALYZE stage immediately followed by EXECUTE triggers the {@link ExecutionGate}.
 *       A block records every directly following EXECUTE stage as SKIPPED without running it.</li>
 *   <li>A successful VERIFY stage reports the realised P&amp;L to the {@link RiskGate}.</li>
 * </ul>
 *
 * <h3>Failure handling</h3>
 * A failed stage is persisted as FAILED. With {@link ErrorHandlingStrategy#STOP} the execution
 * fails; with SKIP or CONTINUE it proceeds. A parallel group only stops the run when every
 * member failed. Event and stage-result persistence failures are logged and never abort a run;
 * execution status updates do propagate.
 */
@Service
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final AgentRunner agentRunner;
    private final ExecutionGate executionGate;
    private final RiskGate riskGate;
    private final TradeMetricsExtractor tradeMetrics;
    private final ParallelAggregator aggregator;
    private final WorkflowValidator validator;
    private final ExecutionRepository repository;
    private final ExecutionEventPublisher eventPublisher;
    private final ExecutorSettings settings;
    private final Clock clock;

    private final ConcurrentHashMap<String, ExecutionContext> activeExecutions = new ConcurrentHashMap<>();

    public WorkflowExecutor(AgentRunner agentRunner,
                            ExecutionGate executionGate,
                            RiskGate riskGate,
                            TradeMetricsExtractor tradeMetrics,
                            ParallelAggregator aggregator,
                            WorkflowValidator validator,
                            ExecutionRepository repository,
                            ExecutionEventPublisher eventPublisher,
                            ExecutorSettings settings,
                            Clock clock) {
        this.agentRunner    = agentRunner;
        this.executionGate  = executionGate;
        this.riskGate       = riskGate;
        this.tradeMetrics   = tradeMetrics;
        this.aggregator     = aggregator;
        this.validator      = validator;
        this.repository     = repository;
        this.eventPublisher = eventPublisher;
        this.settings       = settings;
        this.clock          = clock;
    }

    // ── Public API ──────────────────────────────────────────────────────────

    /**
     * Validates and runs {@code workflow}.
     *
     * <p>Invalid workflows and unknown start/stop stages fail with {@link ConfigurationException}
     * before any execution record is created. A cancelled run completes with the CANCELLED record
     * rather than an error.
     */
    public Mono<WorkflowExecution> executeWorkflow(Workflow workflow, ExecutionOptions options, String userId) {
        ExecutionOptions opts = options != null ? options : ExecutionOptions.defaults();
        return Mono.fromCallable(() -> plan(workflow, opts))
            .flatMap(plan -> repository.createExecution(workflow.id(), userId, opts.triggerType(), metadata(opts))
                .flatMap(execution -> run(plan, execution.id(), userId)));
    }

    /**
     * Stops a running execution: the stage in flight is unsubscribed and no further stage starts.
     *
     * @throws ExecutionNotRunningException (as error signal) if the id is not active
     */
    public Mono<Void> cancelExecution(String executionId) {
        return Mono.defer(() -> {
            ExecutionContext ctx = activeExecutions.get(executionId);
            if (ctx == null || !ctx.tryTerminate()) {
                return Mono.error(new ExecutionNotRunningException(executionId));
            }
            ctx.cancel();
            activeExecutions.remove(executionId);
            TraceContextUtil.withMdc(executionId, () ->
                log.info("Execution cancel requested. executionId={} stageIndex={}", executionId, ctx.currentIndex()));
            return repository.updateStatus(executionId, ExecutionStatus.CANCELLED, null)
                .then(emit(executionId, ExecutionEventType.EXECUTION_CANCELLED, null,
                    data("workflowId", ctx.workflowId(), "stageIndex", ctx.currentIndex())));
        });
    }

    /**
     * Starts a new execution that replaces a FAILED one, optionally resuming at {@code fromAgentId}.
     * The new execution's metadata links back through {@code retryOf}.
     */
    public Mono<WorkflowExecution> retryExecution(Workflow workflow, String failedExecutionId, String fromAgentId,
                                                  String userId) {
        return repository.findById(failedExecutionId)
            .switchIfEmpty(Mono.error(() -> new ExecutionNotFoundException(failedExecutionId)))
            .flatMap(previous -> {
                if (previous.status() != ExecutionStatus.FAILED) {
                    return Mono.error(new ExecutionNotRetryableException(failedExecutionId, previous.status()));
                }
                if (!workflow.id().equals(previous.workflowId())) {
                    return Mono.error(new ConfigurationException("Execution " + failedExecutionId
                        + " belongs to workflow " + previous.workflowId() + ", not " + workflow.id()));
                }
                log.info("Retrying execution. failedExecutionId={} fromAgent={}", failedExecutionId, fromAgentId);
                ExecutionOptions options = ExecutionOptions.defaults()
                    .withStartFromAgent(fromAgentId)
                    .withRetryOf(failedExecutionId);
                return executeWorkflow(workflow, options, userId != null ? userId : previous.triggeredBy());
            });
    }

    public Set<String> getActiveExecutions() {
        return Set.copyOf(activeExecutions.keySet());
    }

    public boolean isExecutionActive(String executionId) {
        return activeExecutions.containsKey(executionId);
    }

    public Optional<ExecutionContext> getExecutionContext(String executionId) {
        return Optional.ofNullable(activeExecutions.get(executionId));
    }

    // ── Planning ────────────────────────────────────────────────────────────

    private ExecutionPlan plan(Workflow workflow, ExecutionOptions options) {
        validator.requireValid(workflow);
        List<StageNode> stages = workflow.sortedStages();
        int start = options.startFromAgent() == null ? 0 : indexOf(stages, options.startFromAgent());
        int end = options.stopAtAgent() == null ? stages.size() - 1 : indexOf(stages, options.stopAtAgent());
        if (start < 0) {
            throw new ConfigurationException("Invalid start agent specified: " + options.startFromAgent());
        }
        if (end < 0) {
            throw new ConfigurationException("Invalid stop agent specified: " + options.stopAtAgent());
        }
        if (start > end) {
            throw new ConfigurationException("Start agent " + options.startFromAgent()
                + " comes after stop agent " + options.stopAtAgent());
        }
        return new ExecutionPlan(workflow, stages, start, end, options);
    }

    private static int indexOf(List<StageNode> stages, String stageId) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).id().equals(stageId)) {
                return i;
            }
        }
        return -1;
    }

    private static Map<String, Object> metadata(ExecutionOptions options) {
        Map<String, Object> opts = data(
            "dryRun", options.dryRun(),
            "startFromAgent", options.startFromAgent(),
            "stopAtAgent", options.stopAtAgent(),
            "timeoutSeconds", options.timeoutSeconds(),
            "triggerType", options.triggerType().name());
        return data("dryRun", options.dryRun(), "options", opts, "retryOf", options.retryOf());
    }

    // ── Run lifecycle ───────────────────────────────────────────────────────

    private Mono<WorkflowExecution> run(ExecutionPlan plan, String executionId, String userId) {
        Workflow workflow = plan.workflow();
        ExecutionContext ctx = new ExecutionContext(executionId, workflow.id(), userId, clock.instant());
        activeExecutions.put(executionId, ctx);
        TraceContextUtil.withMdc(executionId, () ->
            log.info("Workflow execution started. executionId={} workflowId={} name={} stages={} dryRun={}",
                executionId, workflow.id(), workflow.name(), plan.endIndex() - plan.startIndex() + 1,
                plan.options().dryRun()));

        Mono<WorkflowExecution> pipeline =
            emit(executionId, ExecutionEventType.EXECUTION_STARTED, null,
                    data("workflowId", workflow.id(), "workflowName", workflow.name(),
                        "dryRun", plan.options().dryRun()))
                .then(repository.updateStatus(executionId, ExecutionStatus.RUNNING, null))
                .then(Mono.defer(() -> plan.options().dryRun()
                    ? Mono.<Void>fromRunnable(() -> log.info("Dry run, no stages dispatched. executionId={}", executionId))
                    : runFrom(plan, ctx, plan.startIndex())))
                .then(Mono.defer(() -> complete(ctx)))
                .onErrorResume(e -> fail(ctx, e))
                .doFinally(signal -> activeExecutions.remove(executionId, ctx));

        return TraceContextUtil.withExecutionId(pipeline, executionId);
    }

    private Mono<WorkflowExecution> complete(ExecutionContext ctx) {
        if (!ctx.tryTerminate()) {
            return cancelled(ctx);
        }
        long durationMs = Duration.between(ctx.startTime(), clock.instant()).toMillis();
        return repository.updateStatus(ctx.executionId(), ExecutionStatus.COMPLETED, null)
            .then(emit(ctx.executionId(), ExecutionEventType.EXECUTION_COMPLETED, null,
                data("workflowId", ctx.workflowId(), "durationMs", durationMs,
                    "agentsExecuted", ctx.stagesExecuted())))
            .then(Mono.fromRunnable(() -> TraceContextUtil.withMdc(ctx.executionId(), () ->
                log.info("Workflow execution completed. executionId={} durationMs={} agentsExecuted={}",
                    ctx.executionId(), durationMs, ctx.stagesExecuted()))))
            .then(loadWithResults(ctx.executionId()));
    }

    private Mono<WorkflowExecution> fail(ExecutionContext ctx, Throwable e) {
        if (e instanceof ExecutionCancelledException || !ctx.tryTerminate()) {
            return cancelled(ctx);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        TraceContextUtil.withMdc(ctx.executionId(), () ->
            log.error("Workflow execution failed. executionId={} workflowId={} error={}",
                ctx.executionId(), ctx.workflowId(), message, e));
        return repository.updateStatus(ctx.executionId(), ExecutionStatus.FAILED, message)
            .then(emit(ctx.executionId(), ExecutionEventType.EXECUTION_FAILED, null,
                data("workflowId", ctx.workflowId(), "error", message)))
            .then(Mono.error(e));
    }

    /** Cancel requests write CANCELLED too; writing it again here makes the returned record deterministic. */
    private Mono<WorkflowExecution> cancelled(ExecutionContext ctx) {
        log.info("Workflow execution cancelled. executionId={}", ctx.executionId());
        return repository.updateStatus(ctx.executionId(), ExecutionStatus.CANCELLED, null)
            .then(loadWithResults(ctx.executionId()));
    }

    private Mono<WorkflowExecution> loadWithResults(String executionId) {
        return Mono.zip(
                repository.findById(executionId),
                repository.findAgentResultsByExecutionId(executionId).collectList())
            .map(t -> t.getT1().withResults(t.getT2()));
    }

    // ── Stage loop ──────────────────────────────────────────────────────────

    private Mono<Void> runFrom(ExecutionPlan plan, ExecutionContext ctx, int index) {
        if (index > plan.endIndex()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            if (ctx.isCancelled()) {
                return Mono.error(new ExecutionCancelledException(ctx.executionId()));
            }
            ctx.setCurrentIndex(index);
            StageNode node = plan.stage(index);
            if (node.category() == StageCategory.MONITOR) {
                int groupEnd = index;
                while (groupEnd + 1 <= plan.endIndex() && plan.stage(groupEnd + 1).category() == StageCategory.MONITOR) {
                    groupEnd++;
                }
                int next = groupEnd + 1;
                return runParallelGroup(plan, ctx, index, groupEnd).then(runFrom(plan, ctx, next));
            }
            return runSequentialStage(plan, ctx, index).flatMap(next -> runFrom(plan, ctx, next));
        });
    }

    /** @return index of the next stage to run */
    private Mono<Integer> runSequentialStage(ExecutionPlan plan, ExecutionContext ctx, int index) {
        StageNode node = plan.stage(index);
        Map<String, Object> input = node.category() == StageCategory.COLLECT ? Map.of() : ctx.previousOutput();
        log.info("Executing stage {}/{}. executionId={} stageId={} stageType={} category={}",
            index + 1, plan.stages().size(), ctx.executionId(), node.id(), node.stageType(), node.category());

        return emit(ctx.executionId(), ExecutionEventType.AGENT_STARTED, node.id(),
                data("stageType", node.stageType(), "category", node.category().name(), "orderIndex", index))
            .then(agentRunner.run(node, agentInput(ctx, node, input), timeoutFor(plan, node), ctx.cancellationSignal()))
            .flatMap(run -> onStageSuccess(ctx, index, node, input, run))
            .onErrorResume(StageExecutionException.class, e -> onStageFailure(plan, ctx, index, node, input, e))
            .flatMap(succeeded -> afterStage(plan, ctx, index, node, succeeded));
    }

    private Mono<Boolean> onStageSuccess(ExecutionContext ctx, int index, StageNode node,
                                         Map<String, Object> input, StageRun run) {
        ctx.recordStageOutput(node.id(), run.output());
        ctx.setPreviousOutput(run.output());
        if (node.category() == StageCategory.ANALYZE) {
            ctx.setAnalyzeOutput(run.output());
        }
        return saveResult(successResult(ctx, index, node, input, run))
            .then(emit(ctx.executionId(), ExecutionEventType.AGENT_COMPLETED, node.id(),
                data("stageType", node.stageType(), "durationMs", run.durationMs(), "output", run.output())))
            .thenReturn(Boolean.TRUE);
    }

    private Mono<Boolean> onStageFailure(ExecutionPlan plan, ExecutionContext ctx, int index, StageNode node,
                                         Map<String, Object> input, StageExecutionException e) {
        log.error("Stage failed. executionId={} stageId={} error={}", ctx.executionId(), node.id(), e.getMessage());
        if (node.category() == StageCategory.ANALYZE) {
            ctx.setAnalyzeOutput(null);
        }
        if (node.category() == StageCategory.EXECUTE && ctx.tradeReserved()) {
            riskGate.decrementActiveTrades(ctx.userId());
            ctx.setTradeReserved(false);
        }
        ErrorHandlingStrategy strategy = plan.workflow().settings().errorHandling();
        return saveResult(failedResult(ctx, index, node, input, e))
            .then(emit(ctx.executionId(), ExecutionEventType.AGENT_FAILED, node.id(),
                data("stageType", node.stageType(), "error", e.getMessage())))
            .then(strategy == ErrorHandlingStrategy.STOP
                ? Mono.<Boolean>error(e)
                : Mono.fromCallable(() -> {
                    log.warn("Continuing after failed stage. executionId={} stageId={} strategy={}",
                        ctx.executionId(), node.id(), strategy);
                    return Boolean.FALSE;
                }));
    }

    private Mono<Integer> afterStage(ExecutionPlan plan, ExecutionContext ctx, int index, StageNode node,
                                     boolean succeeded) {
        Mono<Void> verify = node.category() == StageCategory.VERIFY && succeeded && ctx.userId() != null
            ? recordTradeResult(ctx, ctx.previousOutput())
            : Mono.empty();

        boolean gated = node.category() == StageCategory.ANALYZE
            && index + 1 <= plan.endIndex()
            && plan.stage(index + 1).category() == StageCategory.EXECUTE;

        return verify.then(gated ? applyGate(plan, ctx, index) : Mono.just(index + 1));
    }

    // ── Parallel groups ─────────────────────────────────────────────────────

    private Mono<Void> runParallelGroup(ExecutionPlan plan, ExecutionContext ctx, int from, int to) {
        List<StageNode> group = plan.stages().subList(from, to + 1);
        Map<String, Object> input = ctx.previousOutput();
        AggregationStrategy strategy = AggregationStrategy.fromValue(group.get(0).effectiveConfig().aggregationStrategy());
        Instant groupStart = clock.instant();
        AtomicInteger settled = new AtomicInteger();
        log.info("Dispatching parallel group. executionId={} stages={} strategy={}",
            ctx.executionId(), group.stream().map(StageNode::id).collect(Collectors.toList()), strategy.value());

        return Flux.range(from, group.size())
            .concatMap(i -> emit(ctx.executionId(), ExecutionEventType.AGENT_STARTED, plan.stage(i).id(),
                data("stageType", plan.stage(i).stageType(), "category", StageCategory.MONITOR.name(),
                    "orderIndex", i, "parallel", true)))
            .then(Flux.range(from, group.size())
                .flatMap(i -> runGroupMember(plan, ctx, i, input)
                        .flatMap(member -> emit(ctx.executionId(), ExecutionEventType.AGENT_PROGRESS, null,
                                data("completed", settled.incrementAndGet(), "total", group.size()))
                            .thenReturn(member)),
                    settings.maxConcurrency())
                .collectList())
            .flatMap(members -> {
                List<StageRunResult> results = members.stream()
                    .sorted(Comparator.comparingInt(GroupMember::index))
                    .map(GroupMember::result)
                    .toList();
                long wallClockMs = Duration.between(groupStart, clock.instant()).toMillis();
                Map<String, Object> aggregate = aggregator.aggregate(results, strategy, wallClockMs);
                ctx.setPreviousOutput(aggregate);

                boolean allFailed = results.stream().noneMatch(StageRunResult::success);
                if (allFailed && plan.workflow().settings().errorHandling() == ErrorHandlingStrategy.STOP) {
                    String errors = results.stream()
                        .map(r -> r.agentId() + ": " + r.error())
                        .collect(Collectors.joining("; "));
                    return Mono.error(new StageExecutionException(group.get(0).id(),
                        "All parallel stages failed (" + errors + ")", groupStart, clock.instant(), null));
                }
                log.info("Parallel group settled. executionId={} successful={}/{} wallClockMs={}",
                    ctx.executionId(), results.stream().filter(StageRunResult::success).count(),
                    results.size(), wallClockMs);
                return Mono.empty();
            });
    }

    private Mono<GroupMember> runGroupMember(ExecutionPlan plan, ExecutionContext ctx, int index,
                                             Map<String, Object> input) {
        StageNode node = plan.stage(index);
        return agentRunner.run(node, agentInput(ctx, node, input), timeoutFor(plan, node), ctx.cancellationSignal())
            .flatMap(run -> {
                ctx.recordStageOutput(node.id(), run.output());
                return saveResult(successResult(ctx, index, node, input, run))
                    .then(emit(ctx.executionId(), ExecutionEventType.AGENT_COMPLETED, node.id(),
                        data("stageType", node.stageType(), "durationMs", run.durationMs(), "parallel", true)))
                    .thenReturn(new GroupMember(index, StageRunResult.success(node.id(), node.stageType(),
                        run.output(), run.startTime(), run.endTime())));
            })
            .onErrorResume(StageExecutionException.class, e -> {
                log.warn("Parallel stage failed. executionId={} stageId={} error={}",
                    ctx.executionId(), node.id(), e.getMessage());
                return saveResult(failedResult(ctx, index, node, input, e))
                    .then(emit(ctx.executionId(), ExecutionEventType.AGENT_FAILED, node.id(),
                        data("stageType", node.stageType(), "error", e.getMessage(), "parallel", true)))
                    .thenReturn(new GroupMember(index, StageRunResult.failure(node.id(), node.stageType(),
                        e.getMessage(), e.getStartTime(), e.getEndTime())));
            });
    }

    private record GroupMember(int index, StageRunResult result) {}

    // ── Gate & trade accounting ─────────────────────────────────────────────

    /** @return index of the next stage to run, past any skipped EXECUTE stages */
    private Mono<Integer> applyGate(ExecutionPlan plan, ExecutionContext ctx, int analyzeIndex) {
        StageNode analyzeNode = plan.stage(analyzeIndex);
        Map<String, Object> data = ctx.analyzeOutput() != null ? ctx.analyzeOutput() : ctx.previousOutput();
        return Mono.fromCallable(() -> executionGate.evaluate(plan.workflow(), data, ctx.userId(), ctx.executionId()))
            .flatMap(decision -> {
                ctx.recordGateDiagnostics(analyzeNode.id(), decision.toDiagnostics());
                if (decision.allowed()) {
                    if (decision.tradeReserved()) {
                        ctx.setTradeReserved(true);
                    }
                    return Mono.just(analyzeIndex + 1);
                }
                int next = analyzeIndex + 1;
                while (next <= plan.endIndex() && plan.stage(next).category() == StageCategory.EXECUTE) {
                    next++;
                }
                int resumeAt = next;
                return Flux.range(analyzeIndex + 1, resumeAt - analyzeIndex - 1)
                    .concatMap(i -> skipStage(ctx, i, plan.stage(i), decision))
                    .then(Mono.just(resumeAt));
            });
    }

    private Mono<Void> skipStage(ExecutionContext ctx, int index, StageNode node, GateDecision decision) {
        Instant now = clock.instant();
        log.info("Stage skipped. executionId={} stageId={} outcome={}", ctx.executionId(), node.id(), decision.outcome());
        AgentExecutionResult skipped = new AgentExecutionResult(null, ctx.executionId(), node.id(), node.stageType(),
            node.category(), StageResultStatus.SKIPPED, index, ctx.previousOutput(), Map.of(), now, now, 0L,
            Map.of(), decision.reason());
        return saveResult(skipped)
            .then(emit(ctx.executionId(), ExecutionEventType.AGENT_SKIPPED, node.id(),
                data("stageType", node.stageType(), "reason", decision.reason(),
                    "outcome", decision.outcome().name())));
    }

    private Mono<Void> recordTradeResult(ExecutionContext ctx, Map<String, Object> verifyOutput) {
        return Mono.fromRunnable(() -> {
                riskGate.recordTradeResult(
                    tradeMetrics.tradeResult(ctx.userId(), ctx.executionId(), verifyOutput, clock.instant()));
                ctx.setTradeReserved(false);
            })
            .onErrorResume(e -> {
                log.warn("Trade result not recorded (non-critical). executionId={} userId={} reason={}",
                    ctx.executionId(), ctx.userId(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    /** Stage override, then run override, then workflow setting, then the process default. */
    private Duration timeoutFor(ExecutionPlan plan, StageNode node) {
        Integer seconds = node.effectiveConfig().timeoutSeconds();
        if (seconds == null) {
            seconds = plan.options().timeoutSeconds();
        }
        if (seconds == null) {
            seconds = plan.workflow().settings().executionTimeoutSeconds();
        }
        return seconds != null ? Duration.ofSeconds(seconds) : settings.defaultStageTimeout();
    }

    private static AgentInput agentInput(ExecutionContext ctx, StageNode node, Map<String, Object> input) {
        return new AgentInput(ctx.executionId(), node.id(), ctx.userId(), input);
    }

    private static AgentExecutionResult successResult(ExecutionContext ctx, int index, StageNode node,
                                                      Map<String, Object> input, StageRun run) {
        return new AgentExecutionResult(null, ctx.executionId(), node.id(), node.stageType(), node.category(),
            StageResultStatus.SUCCESS, index, input, run.output(), run.startTime(), run.endTime(),
            run.durationMs(), run.metrics(), null);
    }

    private AgentExecutionResult failedResult(ExecutionContext ctx, int index, StageNode node,
                                              Map<String, Object> input, StageExecutionException e) {
        Instant start = e.getStartTime() != null ? e.getStartTime() : clock.instant();
        Instant end = e.getEndTime() != null ? e.getEndTime() : start;
        return new AgentExecutionResult(null, ctx.executionId(), node.id(), node.stageType(), node.category(),
            StageResultStatus.FAILED, index, input, Map.of(), start, end,
            Duration.between(start, end).toMillis(), Map.of(), e.getMessage());
    }

    private Mono<Void> saveResult(AgentExecutionResult result) {
        return repository.createAgentResult(result)
            .onErrorResume(e -> {
                log.warn("Stage result not persisted (non-critical). executionId={} stageId={} reason={}",
                    result.executionId(), result.agentId(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    /** Persists then broadcasts; a persistence failure still broadcasts the unsaved event. */
    private Mono<Void> emit(String executionId, ExecutionEventType type, String agentId, Map<String, Object> data) {
        ExecutionEvent event = ExecutionEvent.of(executionId, type, agentId, data, clock.instant());
        return repository.createEvent(event)
            .onErrorResume(e -> {
                log.warn("Event not persisted (non-critical). executionId={} eventType={} reason={}",
                    executionId, type.value(), e.getMessage());
                return Mono.just(event);
            })
            .defaultIfEmpty(event)
            .doOnNext(this::broadcast)
            .then();
    }

    private void broadcast(ExecutionEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event broadcast failed (non-critical). executionId={} eventType={} reason={}",
                event.executionId(), event.eventType().value(), e.getMessage());
        }
    }

    /** Ordered key/value map that drops null values. */
    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}
