package com.workflowplatform.orchestrator.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskStatistics(
    @JsonProperty("totalUsers")            int totalUsers,
    @JsonProperty("usersWithActiveTrades") int usersWithActiveTrades,
    @JsonProperty("usersInCooldown")       int usersInCooldown,
    @JsonProperty("usersNearDailyLimit")   int usersNearDailyLimit,
    @JsonProperty("totalActiveTrades")     int totalActiveTrades
) {}
