package com.workflowplatform.orchestrator.gate;

/**
 * Result of the pre-EXECUTE gate.
 *
 * <ul>
 *   <li>{@link #ALLOWED}         : decision rules (if any) passed and risk checks (if any) passed.</li>
 *   <li>{@link #DECISION_BLOCKED}: decision rules not met; risk was not evaluated.</li>
 *   <li>{@link #RISK_BLOCKED}    : a risk limit failed, or risk controls are configured without a user.</li>
 * </ul>
 */
public enum GateOutcome {
    ALLOWED,
    DECISION_BLOCKED,
    RISK_BLOCKED
}
