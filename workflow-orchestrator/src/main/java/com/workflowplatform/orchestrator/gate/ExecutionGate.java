package com.workflowplatform.orchestrator.gate;

import com.workflowplatform.common.decision.DecisionEngine;
import com.workflowplatform.common.decision.DecisionResult;
import com.workflowplatform.common.model.DecisionConfig;
import com.workflowplatform.common.model.RiskControlConfig;
import com.workflowplatform.common.model.Workflow;
import com.workflowplatform.common.risk.RiskCheckResult;
import com.workflowplatform.orchestrator.risk.RiskGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether the EXECUTE stages following an ANALYZE stage may run.
 *
 * <p>Gate order: decision rules first, then risk. Risk is only consulted (and a trade only
 * reserved) when the decision passed, so a blocked decision never touches the user's
 * active-trade count.
 */
@Component
public class ExecutionGate {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGate.class);

    private final DecisionEngine decisionEngine;
    private final RiskGate riskGate;
    private final TradeMetricsExtractor tradeMetrics;

    public ExecutionGate(DecisionEngine decisionEngine, RiskGate riskGate, TradeMetricsExtractor tradeMetrics) {
        this.decisionEngine = decisionEngine;
        this.riskGate       = riskGate;
        this.tradeMetrics   = tradeMetrics;
    }

    public GateDecision evaluate(Workflow workflow, Map<String, Object> data, String userId, String executionId) {
        Map<String, Object> input = data != null ? data : Map.of();

        DecisionResult decision = null;
        DecisionConfig decisionConfig = workflow.decisionConfig();
        if (decisionConfig != null) {
            decision = decisionEngine.evaluate(decisionConfig, input);
            if (!decision.passed()) {
                String reason = "Decision rules not met: " + decision.failureSummary();
                log.info("Gate blocked by decision. executionId={} reason={}", executionId, reason);
                return new GateDecision(GateOutcome.DECISION_BLOCKED, reason, decision, null, false);
            }
        }

        RiskControlConfig riskControls = workflow.settings().riskControls();
        if (riskControls == null) {
            return new GateDecision(GateOutcome.ALLOWED, null, decision, null, false);
        }
        if (userId == null) {
            String reason = "Risk controls require a user";
            log.warn("Gate blocked by risk. executionId={} reason={}", executionId, reason);
            return new GateDecision(GateOutcome.RISK_BLOCKED, reason, decision, null, false);
        }

        double tradeSize = tradeMetrics.tradeSize(input);
        double portfolioValue = tradeMetrics.portfolioValue(input);
        RiskCheckResult risk = riskGate.tryReserveTrade(userId, tradeSize, portfolioValue, riskControls, executionId);
        if (!risk.allowed()) {
            String reason = "Risk check failed: " + risk.failureSummary();
            log.info("Gate blocked by risk. executionId={} userId={} reason={}", executionId, userId, reason);
            return new GateDecision(GateOutcome.RISK_BLOCKED, reason, decision, risk, false);
        }
        return new GateDecision(GateOutcome.ALLOWED, null, decision, risk, true);
    }
}
