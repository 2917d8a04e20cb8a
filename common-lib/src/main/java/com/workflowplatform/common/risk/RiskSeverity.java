package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * <ul>
 *   <li>{@link #INFO}    : passing, comfortably inside the limit.</li>
 *   <li>{@link #WARNING} : passing above 80% of the limit, or an active cooldown.</li>
 *   <li>{@link #CRITICAL}: failing limit check.</li>
 * </ul>
 */
public enum RiskSeverity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
