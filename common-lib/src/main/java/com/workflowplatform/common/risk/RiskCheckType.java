package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskCheckType {
    POSITION_SIZE,
    DAILY_LOSS,
    CONCURRENT_TRADES,
    COOLDOWN,
    MAX_LOSS_PER_TRADE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
