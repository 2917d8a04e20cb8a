package com.workflowplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-workflow risk limits applied before an EXECUTE stage runs.
 *
 * <p>Percentages are of portfolio value; {@code cooldownPeriod} is in seconds.
 */
public record RiskControlConfig(
    @JsonProperty("maxPositionSize")     double maxPositionSize,
    @JsonProperty("maxDailyLoss")        double maxDailyLoss,
    @JsonProperty("maxConcurrentTrades") int maxConcurrentTrades,
    @JsonProperty("cooldownPeriod")      long cooldownPeriod,
    @JsonProperty("maxLossPerTrade")     double maxLossPerTrade
) {}
