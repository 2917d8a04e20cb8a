package com.workflowplatform.orchestrator.service;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one running execution. Owned by a single {@code executeWorkflow} call and
 * visible through the executor's active registry until the run terminates.
 *
 * <p>{@code agentResults} maps stage id to output. The gate adds one diagnostic entry keyed
 * {@code gate:<analyzeStageId>} per evaluation and nothing else.
 */
public class ExecutionContext {

    public static final String GATE_KEY_PREFIX = "gate:";

    private final String executionId;
    private final String workflowId;
    private final String userId;
    private final Instant startTime;
    private final Map<String, Object> agentResults = new ConcurrentHashMap<>();
    private final Sinks.One<Boolean> cancellation = Sinks.one();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final AtomicInteger stagesExecuted = new AtomicInteger();

    private volatile int currentIndex;
    private volatile Map<String, Object> previousOutput = Map.of();
    private volatile Map<String, Object> analyzeOutput;
    private volatile boolean tradeReserved;

    public ExecutionContext(String executionId, String workflowId, String userId, Instant startTime) {
        this.executionId = executionId;
        this.workflowId  = workflowId;
        this.userId      = userId;
        this.startTime   = startTime;
    }

    /**
     * Claims the right to write the execution's terminal status. Exactly one caller wins:
     * either the run itself (COMPLETED/FAILED) or a cancel request.
     */
    boolean tryTerminate() {
        return terminated.compareAndSet(false, true);
    }

    void cancel() {
        cancelled.set(true);
        cancellation.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Emits once when the execution is cancelled; late subscribers see the signal immediately. */
    public Mono<Boolean> cancellationSignal() {
        return cancellation.asMono();
    }

    void recordStageOutput(String stageId, Map<String, Object> output) {
        agentResults.put(stageId, output);
        stagesExecuted.incrementAndGet();
    }

    void recordGateDiagnostics(String analyzeStageId, Map<String, Object> diagnostics) {
        agentResults.put(GATE_KEY_PREFIX + analyzeStageId, diagnostics);
    }

    public String executionId()              { return executionId; }
    public String workflowId()               { return workflowId; }
    public String userId()                   { return userId; }
    public Instant startTime()               { return startTime; }
    public Map<String, Object> agentResults() { return Map.copyOf(agentResults); }
    public int stagesExecuted()              { return stagesExecuted.get(); }
    public int currentIndex()                { return currentIndex; }
    public Map<String, Object> previousOutput() { return previousOutput; }
    public Map<String, Object> analyzeOutput()  { return analyzeOutput; }
    public boolean tradeReserved()           { return tradeReserved; }

    void setCurrentIndex(int currentIndex)                    { this.currentIndex = currentIndex; }
    void setPreviousOutput(Map<String, Object> previousOutput) { this.previousOutput = previousOutput; }
    void setAnalyzeOutput(Map<String, Object> analyzeOutput)   { this.analyzeOutput = analyzeOutput; }
    void setTradeReserved(boolean tradeReserved)              { this.tradeReserved = tradeReserved; }
}
