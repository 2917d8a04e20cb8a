package com.workflowplatform.orchestrator.gate;

import com.workflowplatform.common.decision.DecisionResult;
import com.workflowplatform.common.risk.RiskCheckResult;

import java.util.LinkedHashMap;
import java.util.Map;

public record GateDecision(
    GateOutcome outcome,
    String reason,
    DecisionResult decision,      // null when no decision config
    RiskCheckResult risk,         // null when risk was not evaluated
    boolean tradeReserved
) {
    public boolean allowed() {
        return outcome == GateOutcome.ALLOWED;
    }

    /** Compact form stored in the execution context as the gate's diagnostic entry. */
    public Map<String, Object> toDiagnostics() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("outcome", outcome.name());
        if (reason != null) {
            map.put("reason", reason);
        }
        if (decision != null) {
            map.put("decisionPassed", decision.passed());
            map.put("rulesPassed", decision.passedCount());
            map.put("rulesTotal", decision.ruleResults().size());
        }
        if (risk != null) {
            map.put("riskAllowed", risk.allowed());
            map.put("riskWarnings", risk.warnings());
        }
        map.put("tradeReserved", tradeReserved);
        return map;
    }
}
