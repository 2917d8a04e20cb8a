package com.workflowplatform.orchestrator.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Clears stale daily-loss counters at the start of every UTC day. */
@Component
public class DailyRiskResetJob {

    private static final Logger log = LoggerFactory.getLogger(DailyRiskResetJob.class);

    private final RiskGate riskGate;

    public DailyRiskResetJob(RiskGate riskGate) {
        this.riskGate = riskGate;
    }

    @Scheduled(cron = "${orchestrator.risk.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    public void resetDailyLoss() {
        log.info("Daily risk reset triggered");
        riskGate.resetAllDailyLoss();
    }
}
