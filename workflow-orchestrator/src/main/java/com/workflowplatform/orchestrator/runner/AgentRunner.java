package com.workflowplatform.orchestrator.runner;

import com.workflowplatform.common.agent.Agent;
import com.workflowplatform.common.agent.AgentFactory;
import com.workflowplatform.common.agent.AgentInput;
import com.workflowplatform.common.agent.AgentMetrics;
import com.workflowplatform.common.exception.ExecutionCancelledException;
import com.workflowplatform.common.exception.StageExecutionException;
import com.workflowplatform.common.exception.StageTimeoutException;
import com.workflowplatform.common.model.StageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single stage: creates the agent, invokes it off the event loop, and enforces the
 * stage timeout and the execution's cancellation signal.
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>{@link Agent#cleanup()} is called exactly once per created agent, including on timeout
 *       and cancellation. Cleanup failures are logged and never change the outcome.</li>
 *   <li>Timeout → {@link StageTimeoutException}. The abandoned call may keep running on its
 *       worker thread; its result is discarded.</li>
 *   <li>Cancellation → {@link ExecutionCancelledException}; the in-flight call is unsubscribed.</li>
 *   <li>Any other failure (including an unknown stage type) → {@link StageExecutionException}
 *       carrying the attempt's start and end time.</li>
 * </ul>
 */
@Component
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final AgentFactory agentFactory;
    private final Clock clock;

    public AgentRunner(AgentFactory agentFactory, Clock clock) {
        this.agentFactory = agentFactory;
        this.clock        = clock;
    }

    public Mono<StageRun> run(StageNode node, AgentInput input, Duration timeout, Mono<?> cancellation) {
        return Mono.defer(() -> {
            Instant start = clock.instant();
            return Mono.using(
                    () -> agentFactory.createAgent(node.stageType(), node.effectiveConfig()),
                    agent -> Mono.fromCallable(() -> invoke(agent, input))
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(timeout)
                        .map(invocation -> toStageRun(node, agent, invocation, start)),
                    agent -> cleanup(node, agent))
                .takeUntilOther(cancellation)
                .switchIfEmpty(Mono.error(() -> new ExecutionCancelledException(input.executionId())))
                .onErrorMap(e -> !(e instanceof ExecutionCancelledException)
                        && !(e instanceof StageExecutionException),
                    e -> toStageFailure(node, e, timeout, start))
                .doOnSuccess(run -> log.info("Stage completed. executionId={} stageId={} stageType={} durationMs={}",
                    input.executionId(), node.id(), node.stageType(), run.durationMs()));
        });
    }

    private Invocation invoke(Agent agent, AgentInput input) throws Exception {
        Runtime runtime = Runtime.getRuntime();
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        boolean cpuTimeSupported = threads.isCurrentThreadCpuTimeSupported();

        long memoryBefore = runtime.totalMemory() - runtime.freeMemory();
        long cpuBefore = cpuTimeSupported ? threads.getCurrentThreadCpuTime() : 0L;

        Map<String, Object> output = agent.execute(input);

        long cpuNanos = cpuTimeSupported ? threads.getCurrentThreadCpuTime() - cpuBefore : 0L;
        long memoryUsed = Math.max(0L, runtime.totalMemory() - runtime.freeMemory() - memoryBefore);
        return new Invocation(output == null ? Map.of() : output, memoryUsed, cpuNanos / 1_000_000);
    }

    private StageRun toStageRun(StageNode node, Agent agent, Invocation invocation, Instant start) {
        Instant end = clock.instant();
        AgentMetrics reported;
        try {
            reported = agent.getMetrics();
        } catch (RuntimeException e) {
            log.warn("Agent metrics unavailable. stageId={} reason={}", node.id(), e.getMessage());
            reported = null;
        }
        AgentMetrics metrics = new AgentMetrics(
            Duration.between(start, end).toMillis(),
            invocation.memoryUsed(),
            invocation.cpuTimeMs(),
            reported != null ? reported.custom() : Map.of());
        return new StageRun(node.id(), invocation.output(), metrics.toMap(), start, end);
    }

    private StageExecutionException toStageFailure(StageNode node, Throwable e, Duration timeout, Instant start) {
        Instant end = clock.instant();
        if (e instanceof TimeoutException) {
            log.warn("Stage timed out. stageId={} timeoutMs={}", node.id(), timeout.toMillis());
            return new StageTimeoutException(node.id(), timeout, start, end);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Stage failed. stageId={} stageType={} reason={}", node.id(), node.stageType(), message);
        return new StageExecutionException(node.id(), message, start, end, e);
    }

    private static void cleanup(StageNode node, Agent agent) {
        try {
            agent.cleanup();
        } catch (Exception e) {
            log.warn("Agent cleanup failed. stageId={} reason={}", node.id(), e.getMessage());
        }
    }

    private record Invocation(Map<String, Object> output, long memoryUsed, long cpuTimeMs) {}
}
