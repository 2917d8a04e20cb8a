package com.workflowplatform.orchestrator.service;

import com.workflowplatform.common.aggregation.ParallelAggregator;
import com.workflowplatform.common.decision.DecisionEngine;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.exception.ExecutionNotFoundException;
import com.workflowplatform.common.exception.ExecutionNotRetryableException;
import com.workflowplatform.common.exception.ExecutionNotRunningException;
import com.workflowplatform.common.exception.StageExecutionException;
import com.workflowplatform.common.exception.StageTimeoutException;
import com.workflowplatform.common.model.AgentExecutionResult;
import com.workflowplatform.common.model.DecisionConfig;
import com.workflowplatform.common.model.DecisionRule;
import com.workflowplatform.common.model.ErrorHandlingStrategy;
import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionEventType;
import com.workflowplatform.common.model.ExecutionOptions;
import com.workflowplatform.common.model.ExecutionStatus;
import com.workflowplatform.common.model.RiskControlConfig;
import com.workflowplatform.common.model.StageCategory;
import com.workflowplatform.common.model.StageConfig;
import com.workflowplatform.common.model.StageNode;
import com.workflowplatform.common.model.StageResultStatus;
import com.workflowplatform.common.model.TriggerType;
import com.workflowplatform.common.model.Workflow;
import com.workflowplatform.common.model.WorkflowExecution;
import com.workflowplatform.common.model.WorkflowSettings;
import com.workflowplatform.common.validation.WorkflowValidator;
import com.workflowplatform.orchestrator.gate.ExecutionGate;
import com.workflowplatform.orchestrator.gate.TradeMetricsExtractor;
import com.workflowplatform.orchestrator.persistence.InMemoryExecutionRepository;
import com.workflowplatform.orchestrator.risk.RiskGate;
import com.workflowplatform.orchestrator.risk.UserRiskStateStore;
import com.workflowplatform.orchestrator.runner.AgentRunner;
import com.workflowplatform.orchestrator.support.ScriptedAgentFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowExecutorTest {

    private static final RiskControlConfig RISK = new RiskControlConfig(5, 10, 3, 300, 5);

    private ScriptedAgentFactory agents;
    private InMemoryExecutionRepository repository;
    private RiskGate riskGate;
    private List<ExecutionEvent> published;
    private WorkflowExecutor executor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        agents = new ScriptedAgentFactory();
        repository = new InMemoryExecutionRepository(clock);
        riskGate = new RiskGate(new UserRiskStateStore(), clock);
        published = new CopyOnWriteArrayList<>();
        TradeMetricsExtractor tradeMetrics = new TradeMetricsExtractor(10_000);
        DecisionEngine decisionEngine = new DecisionEngine();

        executor = new WorkflowExecutor(
            new AgentRunner(agents, clock),
            new ExecutionGate(decisionEngine, riskGate, tradeMetrics),
            riskGate,
            tradeMetrics,
            new ParallelAggregator(),
            new WorkflowValidator(decisionEngine),
            repository,
            published::add,
            new ExecutorSettings(Duration.ofSeconds(5), 10),
            clock);
    }

    // ── Fixtures ────────────────────────────────────────────────────────────

    private static StageNode stage(String id, StageCategory category, int order) {
        return new StageNode(id, id, category, order, null);
    }

    private static StageNode stage(String id, StageCategory category, int order, Map<String, Object> properties) {
        return new StageNode(id, id, category, order, StageConfig.of(category, properties));
    }

    private static Workflow workflow(ErrorHandlingStrategy strategy, StageNode... stages) {
        return new Workflow("wf-1", "test workflow", List.of(stages), WorkflowSettings.of(strategy), null);
    }

    private static Workflow tradingWorkflow(DecisionConfig decision, StageNode... stages) {
        return new Workflow("wf-trade", "trading", List.of(stages),
            new WorkflowSettings(null, ErrorHandlingStrategy.STOP, RISK), decision);
    }

    private List<ExecutionEventType> eventTypes() {
        return published.stream().map(ExecutionEvent::eventType).toList();
    }

    private static AgentExecutionResult resultFor(WorkflowExecution execution, String agentId) {
        return execution.results().stream()
            .filter(r -> r.agentId().equals(agentId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no result for " + agentId));
    }

    // ── Sequential ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("sequential stages")
    class SequentialTests {

        @Test
        @DisplayName("each stage receives the previous stage's output")
        void outputsFlowForward() {
            agents.returning("fetch", Map.of("rows", 3))
                .on("transform", input -> Map.of("doubled", ((Integer) input.data().get("rows")) * 2))
                .returning("post", Map.of("posted", true));

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("post", StageCategory.PUBLISH, 3),
                stage("fetch", StageCategory.COLLECT, 1),
                stage("transform", StageCategory.PROCESS, 2));

            StepVerifier.create(executor.executeWorkflow(wf, ExecutionOptions.defaults(), "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertNotNull(execution.endTime());
                    assertEquals(List.of("fetch", "transform", "post"),
                        execution.results().stream().map(AgentExecutionResult::agentId).toList());
                    assertEquals(Map.of("doubled", 6), resultFor(execution, "transform").outputData());
                    assertEquals(Map.of("rows", 3), resultFor(execution, "transform").inputData());
                    assertTrue(execution.results().stream().allMatch(r -> r.status() == StageResultStatus.SUCCESS));
                })
                .verifyComplete();

            assertEquals(ExecutionEventType.EXECUTION_STARTED, eventTypes().get(0));
            ExecutionEvent completed = published.get(published.size() - 1);
            assertEquals(ExecutionEventType.EXECUTION_COMPLETED, completed.eventType());
            assertEquals(3, completed.data().get("agentsExecuted"));
            assertTrue(executor.getActiveExecutions().isEmpty());
        }

        @Test
        @DisplayName("COLLECT stages start from an empty input")
        void collectGetsEmptyInput() {
            agents.returning("first", Map.of("a", 1)).returning("collector", Map.of("b", 2));

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("first", StageCategory.PROCESS, 1),
                stage("collector", StageCategory.COLLECT, 2));

            executor.executeWorkflow(wf, null, null).block(Duration.ofSeconds(10));

            assertEquals(Map.of(), agents.inputs().get(1).data());
        }

        @Test
        @DisplayName("SKIP records the failure and completes the run")
        void skipStrategy() {
            agents.returning("a", Map.of("value", 1))
                .failing("b", "bad payload")
                .returning("c", Map.of("done", true));

            Workflow wf = workflow(ErrorHandlingStrategy.SKIP,
                stage("a", StageCategory.COLLECT, 1),
                stage("b", StageCategory.PROCESS, 2),
                stage("c", StageCategory.PUBLISH, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertEquals(1, execution.results().stream()
                        .filter(r -> r.status() == StageResultStatus.FAILED).count());
                    assertTrue(resultFor(execution, "b").error().contains("bad payload"));
                    // c still sees a's output, the failed stage contributes nothing
                    assertEquals(Map.of("value", 1), resultFor(execution, "c").inputData());
                })
                .verifyComplete();

            assertTrue(eventTypes().contains(ExecutionEventType.AGENT_FAILED));
        }

        @Test
        @DisplayName("STOP fails the execution and runs nothing after the failed stage")
        void stopStrategy() {
            agents.returning("a", Map.of()).failing("b", "boom").returning("c", Map.of());

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("a", StageCategory.COLLECT, 1),
                stage("b", StageCategory.PROCESS, 2),
                stage("c", StageCategory.PUBLISH, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .expectError(StageExecutionException.class)
                .verify(Duration.ofSeconds(10));

            assertEquals(0, agents.invocations("c"));
            assertTrue(eventTypes().contains(ExecutionEventType.EXECUTION_FAILED));
            String executionId = published.get(0).executionId();
            WorkflowExecution stored = repository.findById(executionId).block();
            assertEquals(ExecutionStatus.FAILED, stored.status());
            assertTrue(stored.error().contains("boom"));
            assertFalse(executor.isExecutionActive(executionId));
        }

        @Test
        @DisplayName("per-stage timeout overrides the default")
        void stageTimeout() {
            agents.on("slow", input -> {
                Thread.sleep(3_000);
                return Map.of();
            });

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("slow", StageCategory.PROCESS, 1, Map.of("timeoutSeconds", 1)));

            StepVerifier.create(executor.executeWorkflow(wf, null, null))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(StageTimeoutException.class, e);
                    assertTrue(e.getMessage().contains("1000ms"));
                })
                .verify(Duration.ofSeconds(10));
        }
    }

    // ── Options ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("execution options")
    class OptionsTests {

        private final Workflow wf = workflow(ErrorHandlingStrategy.STOP,
            stage("a", StageCategory.COLLECT, 1),
            stage("b", StageCategory.PROCESS, 2),
            stage("c", StageCategory.PROCESS, 3),
            stage("d", StageCategory.PUBLISH, 4));

        @BeforeEach
        void agents() {
            agents.returning("a", Map.of()).returning("b", Map.of())
                .returning("c", Map.of()).returning("d", Map.of());
        }

        @Test
        @DisplayName("start and stop agents select an inclusive slice")
        void slice() {
            ExecutionOptions options = ExecutionOptions.defaults().withStartFromAgent("b").withStopAtAgent("c");

            StepVerifier.create(executor.executeWorkflow(wf, options, "u1"))
                .assertNext(execution -> assertEquals(List.of("b", "c"),
                    execution.results().stream().map(AgentExecutionResult::agentId).toList()))
                .verifyComplete();

            assertEquals(0, agents.invocations("a"));
            assertEquals(0, agents.invocations("d"));
        }

        @Test
        @DisplayName("unknown start agent is rejected before an execution is created")
        void unknownStartAgent() {
            StepVerifier.create(executor.executeWorkflow(wf, ExecutionOptions.defaults().withStartFromAgent("zzz"), "u1"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ConfigurationException.class, e);
                    assertTrue(e.getMessage().contains("Invalid start agent specified: zzz"));
                })
                .verify();

            assertTrue(published.isEmpty());
        }

        @Test
        @DisplayName("invalid workflow fails validation before anything runs")
        void invalidWorkflow() {
            Workflow invalid = workflow(ErrorHandlingStrategy.STOP);

            StepVerifier.create(executor.executeWorkflow(invalid, null, "u1"))
                .expectError(ConfigurationException.class)
                .verify();

            assertTrue(published.isEmpty());
            assertEquals(0, agents.totalInvocations());
        }

        @Test
        @DisplayName("dry run completes without dispatching any stage")
        void dryRun() {
            StepVerifier.create(executor.executeWorkflow(wf, ExecutionOptions.defaults().withDryRun(true), "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertEquals(Boolean.TRUE, execution.metadata().get("dryRun"));
                    assertTrue(execution.results().isEmpty());
                })
                .verifyComplete();

            assertEquals(0, agents.totalInvocations());
        }
    }

    // ── Parallel ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("parallel MONITOR groups")
    class ParallelTests {

        @Test
        @DisplayName("contiguous MONITOR stages are aggregated with the first member's strategy")
        void averageOfGroup() {
            agents.returning("m1", Map.of("price", 10))
                .returning("m2", Map.of("price", 20))
                .returning("m3", Map.of("price", 30))
                .on("analyze", input -> Map.of("seen", input.data().get("price")));

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("m1", StageCategory.MONITOR, 1, Map.of("aggregationStrategy", "average")),
                stage("m2", StageCategory.MONITOR, 2),
                stage("m3", StageCategory.MONITOR, 3),
                stage("analyze", StageCategory.ANALYZE, 4));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertEquals(4, execution.results().size());
                    assertEquals(2, resultFor(execution, "m3").orderIndex());
                    assertEquals(20.0, (double) resultFor(execution, "analyze").outputData().get("seen"), 1e-9);
                })
                .verifyComplete();

            Map<String, Object> analyzeInput = agents.inputs().stream()
                .filter(i -> i.stageId().equals("analyze"))
                .findFirst().orElseThrow().data();
            assertEquals(10.0, (double) analyzeInput.get("price_min"), 1e-9);
            assertEquals(30.0, (double) analyzeInput.get("price_max"), 1e-9);
            assertTrue(analyzeInput.containsKey(ParallelAggregator.METADATA_KEY));
            assertEquals(3, published.stream()
                .filter(e -> e.eventType() == ExecutionEventType.AGENT_PROGRESS).count());
        }

        @Test
        @DisplayName("a partly failed group still aggregates the survivors")
        void partialFailure() {
            agents.returning("m1", Map.of("price", 10))
                .failing("m2", "exchange down")
                .returning("next", Map.of());

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("m1", StageCategory.MONITOR, 1, Map.of("aggregationStrategy", "average")),
                stage("m2", StageCategory.MONITOR, 2),
                stage("next", StageCategory.PROCESS, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertEquals(StageResultStatus.FAILED, resultFor(execution, "m2").status());
                    assertEquals(10.0, (double) resultFor(execution, "next").inputData().get("price"), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("every member failing under STOP fails the execution")
        void allFailed() {
            agents.failing("m1", "down").failing("m2", "down").returning("next", Map.of());

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("m1", StageCategory.MONITOR, 1),
                stage("m2", StageCategory.MONITOR, 2),
                stage("next", StageCategory.PROCESS, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .expectErrorSatisfies(e -> assertTrue(e.getMessage().contains("All parallel stages failed")))
                .verify(Duration.ofSeconds(10));

            assertEquals(0, agents.invocations("next"));
        }
    }

    // ── Gate ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decision and risk gate")
    class GateTests {

        private final DecisionConfig confident = DecisionConfig.of("AND",
            DecisionRule.of("signal.confidence", "gte", 0.7));

        @Test
        @DisplayName("failing decision skips EXECUTE without invoking it")
        void decisionBlocksExecute() {
            agents.returning("analyze", Map.of("signal", Map.of("confidence", 0.3), "tradeSize", 100))
                .returning("execute", Map.of("orderId", "o-1"));

            Workflow wf = tradingWorkflow(confident,
                stage("analyze", StageCategory.ANALYZE, 1),
                stage("execute", StageCategory.EXECUTE, 2));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> {
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    AgentExecutionResult skipped = resultFor(execution, "execute");
                    assertEquals(StageResultStatus.SKIPPED, skipped.status());
                    assertTrue(skipped.error().startsWith("Decision rules not met"));
                })
                .verifyComplete();

            assertEquals(0, agents.invocations("execute"));
            assertTrue(eventTypes().contains(ExecutionEventType.AGENT_SKIPPED));
            assertEquals(0, riskGate.getUserRiskState("u1").activeTrades());
        }

        @Test
        @DisplayName("risk block skips every directly following EXECUTE stage")
        void riskBlocksExecuteRun() {
            agents.returning("analyze", Map.of("signal", Map.of("confidence", 0.9), "tradeSize", 900))
                .returning("buy", Map.of())
                .returning("hedge", Map.of())
                .returning("report", Map.of());

            Workflow wf = tradingWorkflow(confident,
                stage("analyze", StageCategory.ANALYZE, 1),
                stage("buy", StageCategory.EXECUTE, 2),
                stage("hedge", StageCategory.EXECUTE, 3),
                stage("report", StageCategory.PUBLISH, 4));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> {
                    assertEquals(StageResultStatus.SKIPPED, resultFor(execution, "buy").status());
                    assertEquals(StageResultStatus.SKIPPED, resultFor(execution, "hedge").status());
                    assertEquals(StageResultStatus.SUCCESS, resultFor(execution, "report").status());
                })
                .verifyComplete();

            assertEquals(0, agents.invocations("buy") + agents.invocations("hedge"));
        }

        @Test
        @DisplayName("allowed trade runs, and VERIFY books the realised loss")
        void allowedTradeIsVerified() {
            agents.returning("analyze", Map.of("signal", Map.of("confidence", 0.9), "tradeSize", 200))
                .returning("execute", Map.of("orderId", "o-1"))
                .returning("verify", Map.of("profitLoss", -30, "profitLossPercent", -1.5));

            Workflow wf = tradingWorkflow(confident,
                stage("analyze", StageCategory.ANALYZE, 1),
                stage("execute", StageCategory.EXECUTE, 2),
                stage("verify", StageCategory.VERIFY, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .assertNext(execution -> assertEquals(ExecutionStatus.COMPLETED, execution.status()))
                .verifyComplete();

            assertEquals(1, agents.invocations("execute"));
            assertEquals(1.5, riskGate.getUserRiskState("u1").dailyLossPercent(), 1e-9);
            assertEquals(0, riskGate.getUserRiskState("u1").activeTrades());
        }

        @Test
        @DisplayName("a failed EXECUTE releases its reserved trade slot")
        void failedExecuteReleasesSlot() {
            agents.returning("analyze", Map.of("signal", Map.of("confidence", 0.9), "tradeSize", 200))
                .failing("execute", "exchange rejected order");

            Workflow wf = tradingWorkflow(confident,
                stage("analyze", StageCategory.ANALYZE, 1),
                stage("execute", StageCategory.EXECUTE, 2));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .expectError(StageExecutionException.class)
                .verify(Duration.ofSeconds(10));

            assertEquals(0, riskGate.getUserRiskState("u1").activeTrades());
        }
    }

    // ── Cancel & retry ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("cancel and retry")
    class CancelRetryTests {

        @Test
        @DisplayName("cancelling an unknown execution fails")
        void cancelUnknown() {
            StepVerifier.create(executor.cancelExecution("does-not-exist"))
                .expectError(ExecutionNotRunningException.class)
                .verify();
        }

        @Test
        @DisplayName("cancel stops the running stage and leaves the execution CANCELLED")
        void cancelRunning() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            agents.on("slow", input -> {
                    started.countDown();
                    Thread.sleep(10_000);
                    return Map.of();
                })
                .returning("after", Map.of());

            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("slow", StageCategory.PROCESS, 1),
                stage("after", StageCategory.PUBLISH, 2));

            CompletableFuture<WorkflowExecution> running = executor.executeWorkflow(wf, null, "u1").toFuture();
            assertTrue(started.await(5, TimeUnit.SECONDS));
            String executionId = executor.getActiveExecutions().iterator().next();
            assertTrue(executor.getExecutionContext(executionId).isPresent());

            executor.cancelExecution(executionId).block(Duration.ofSeconds(5));
            WorkflowExecution execution = running.get(5, TimeUnit.SECONDS);

            assertEquals(ExecutionStatus.CANCELLED, execution.status());
            assertEquals(0, agents.invocations("after"));
            assertFalse(executor.isExecutionActive(executionId));
            assertTrue(eventTypes().contains(ExecutionEventType.EXECUTION_CANCELLED));
            assertFalse(eventTypes().contains(ExecutionEventType.EXECUTION_COMPLETED));

            StepVerifier.create(executor.cancelExecution(executionId))
                .expectError(ExecutionNotRunningException.class)
                .verify();
        }

        @Test
        @DisplayName("retry resumes a failed execution from the chosen stage")
        void retryFromStage() {
            agents.returning("a", Map.of()).failing("b", "flaky").returning("c", Map.of());
            Workflow wf = workflow(ErrorHandlingStrategy.STOP,
                stage("a", StageCategory.COLLECT, 1),
                stage("b", StageCategory.PROCESS, 2),
                stage("c", StageCategory.PUBLISH, 3));

            StepVerifier.create(executor.executeWorkflow(wf, null, "u1"))
                .expectError(StageExecutionException.class)
                .verify(Duration.ofSeconds(10));
            String failedId = published.get(0).executionId();

            agents.returning("b", Map.of("recovered", true));

            StepVerifier.create(executor.retryExecution(wf, failedId, "b", null))
                .assertNext(execution -> {
                    assertNotEquals(failedId, execution.id());
                    assertEquals(ExecutionStatus.COMPLETED, execution.status());
                    assertEquals(TriggerType.RETRY, execution.triggerType());
                    assertEquals("u1", execution.triggeredBy());
                    assertEquals(failedId, execution.metadata().get("retryOf"));
                    assertEquals(List.of("b", "c"),
                        execution.results().stream().map(AgentExecutionResult::agentId).toList());
                })
                .verifyComplete();

            assertEquals(1, agents.invocations("a"));
        }

        @Test
        @DisplayName("only FAILED executions can be retried")
        void retryRequiresFailed() {
            agents.returning("a", Map.of());
            Workflow wf = workflow(ErrorHandlingStrategy.STOP, stage("a", StageCategory.COLLECT, 1));
            WorkflowExecution completed = executor.executeWorkflow(wf, null, "u1").block(Duration.ofSeconds(10));

            StepVerifier.create(executor.retryExecution(wf, completed.id(), null, "u1"))
                .expectError(ExecutionNotRetryableException.class)
                .verify();
            StepVerifier.create(executor.retryExecution(wf, "missing", null, "u1"))
                .expectError(ExecutionNotFoundException.class)
                .verify();
        }
    }
}
