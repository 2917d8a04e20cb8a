package com.workflowplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable snapshot of one user's intraday risk accounting.
 * {@code lastResetDateKey} is the UTC calendar date ({@code yyyy-MM-dd}) the loss counter belongs to.
 */
public record UserRiskState(
    @JsonProperty("userId")            String userId,
    @JsonProperty("dailyLossPercent")  double dailyLossPercent,
    @JsonProperty("lastLossTimestamp") Instant lastLossTimestamp,
    @JsonProperty("activeTrades")      int activeTrades,
    @JsonProperty("lastResetDateKey")  String lastResetDateKey
) {
    public UserRiskState {
        dailyLossPercent = Math.max(0.0, dailyLossPercent);
        activeTrades = Math.max(0, activeTrades);
    }

    public static UserRiskState fresh(String userId, String dateKey) {
        return new UserRiskState(userId, 0.0, null, 0, dateKey);
    }

    /** Same state with the loss counter cleared for {@code dateKey}. */
    public UserRiskState resetFor(String dateKey) {
        return new UserRiskState(userId, 0.0, lastLossTimestamp, activeTrades, dateKey);
    }

    public UserRiskState withActiveTrades(int count) {
        return new UserRiskState(userId, dailyLossPercent, lastLossTimestamp, count, lastResetDateKey);
    }

    public UserRiskState withLoss(double lossPercent, Instant at) {
        return new UserRiskState(userId, dailyLossPercent + Math.abs(lossPercent), at, activeTrades,
            lastResetDateKey);
    }

    public UserRiskState withProfit(double profitPercent) {
        return new UserRiskState(userId, dailyLossPercent - Math.abs(profitPercent), lastLossTimestamp,
            activeTrades, lastResetDateKey);
    }
}
