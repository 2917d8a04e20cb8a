package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Realised outcome of a trade, reported after a VERIFY stage.
 * {@code profitLoss} is in quote currency; {@code profitLossPercent} is relative to trade size.
 */
public record TradeResult(
    @JsonProperty("userId")            String userId,
    @JsonProperty("profitLoss")        double profitLoss,
    @JsonProperty("profitLossPercent") double profitLossPercent,
    @JsonProperty("tradeSize")         double tradeSize,
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("executionId")       String executionId
) {
    public boolean isLoss() {
        return profitLoss < 0 || profitLossPercent < 0;
    }
}
