package com.workflowplatform.orchestrator.risk;

import com.workflowplatform.common.model.RiskControlConfig;
import com.workflowplatform.common.risk.RiskCheckEvaluator;
import com.workflowplatform.common.risk.RiskCheckResult;
import com.workflowplatform.common.risk.TradeResult;
import com.workflowplatform.common.risk.UserRiskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Quantitative risk gate in front of EXECUTE stages, plus the per-user intraday accounting
 * it depends on.
 *
 * <h3>Daily reset</h3>
 * Each state carries the UTC date it belongs to. The first touch on a new UTC day clears the
 * loss counter; {@link #resetAllDailyLoss()} does the same eagerly for every user and is driven
 * by {@link DailyRiskResetJob}.
 *
 * <p>All reads and writes for one user are serialised through {@link UserRiskStateStore}.
 */
@Component
public class RiskGate {

    private static final Logger log = LoggerFactory.getLogger(RiskGate.class);

    static final Duration STATISTICS_COOLDOWN_WINDOW = Duration.ofMinutes(5);
    static final double   STATISTICS_NEAR_LIMIT_PERCENT = 8.0;

    private final UserRiskStateStore store;
    private final Clock clock;

    public RiskGate(UserRiskStateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /** Evaluates all five checks without reserving anything. */
    public RiskCheckResult checkBeforeExecution(String userId, double tradeSize, double portfolioValue,
                                                RiskControlConfig config, String contextId) {
        Instant now = clock.instant();
        RiskCheckResult[] result = new RiskCheckResult[1];
        store.update(userId, current -> {
            UserRiskState state = ensureCurrent(userId, current, now);
            result[0] = RiskCheckEvaluator.evaluate(state, tradeSize, portfolioValue, config, now);
            return state;
        });
        logResult(userId, tradeSize, contextId, result[0]);
        return result[0];
    }

    /**
     * Check and, when allowed, count the trade as active in the same atomic step, so two
     * concurrent executions cannot both take the last concurrent-trade slot.
     */
    public RiskCheckResult tryReserveTrade(String userId, double tradeSize, double portfolioValue,
                                           RiskControlConfig config, String contextId) {
        Instant now = clock.instant();
        RiskCheckResult[] result = new RiskCheckResult[1];
        UserRiskState updated = store.update(userId, current -> {
            UserRiskState state = ensureCurrent(userId, current, now);
            result[0] = RiskCheckEvaluator.evaluate(state, tradeSize, portfolioValue, config, now);
            return result[0].allowed() ? state.withActiveTrades(state.activeTrades() + 1) : state;
        });
        logResult(userId, tradeSize, contextId, result[0]);
        if (result[0].allowed()) {
            log.info("Trade reserved. userId={} activeTrades={} contextId={}",
                userId, updated.activeTrades(), contextId);
        }
        return result[0];
    }

    public UserRiskState incrementActiveTrades(String userId) {
        Instant now = clock.instant();
        UserRiskState state = store.update(userId,
            current -> {
                UserRiskState s = ensureCurrent(userId, current, now);
                return s.withActiveTrades(s.activeTrades() + 1);
            });
        log.info("Active trades incremented. userId={} activeTrades={}", userId, state.activeTrades());
        return state;
    }

    public UserRiskState decrementActiveTrades(String userId) {
        Instant now = clock.instant();
        UserRiskState state = store.update(userId,
            current -> {
                UserRiskState s = ensureCurrent(userId, current, now);
                return s.withActiveTrades(s.activeTrades() - 1);
            });
        log.info("Active trades decremented. userId={} activeTrades={}", userId, state.activeTrades());
        return state;
    }

    /**
     * Applies a realised trade outcome: a loss adds {@code |profitLossPercent|} and starts the
     * cooldown clock, a profit pays the loss counter down to no less than zero. Either way the
     * trade stops counting as active.
     */
    public UserRiskState recordTradeResult(TradeResult trade) {
        Instant now = clock.instant();
        Instant at = trade.timestamp() != null ? trade.timestamp() : now;
        UserRiskState state = store.update(trade.userId(), current -> {
            UserRiskState s = ensureCurrent(trade.userId(), current, now);
            s = trade.isLoss() ? s.withLoss(trade.profitLossPercent(), at) : s.withProfit(trade.profitLossPercent());
            return s.withActiveTrades(s.activeTrades() - 1);
        });
        if (trade.isLoss()) {
            log.warn("Trade loss recorded. userId={} profitLoss={} dailyLossPercent={} executionId={}",
                trade.userId(), trade.profitLoss(), state.dailyLossPercent(), trade.executionId());
        } else {
            log.info("Trade profit recorded. userId={} profitLoss={} dailyLossPercent={} executionId={}",
                trade.userId(), trade.profitLoss(), state.dailyLossPercent(), trade.executionId());
        }
        return state;
    }

    public UserRiskState getUserRiskState(String userId) {
        Instant now = clock.instant();
        return store.update(userId, current -> ensureCurrent(userId, current, now));
    }

    public UserRiskState resetDailyLoss(String userId) {
        String today = dateKey(clock.instant());
        double[] previous = new double[1];
        UserRiskState state = store.update(userId, current -> {
            UserRiskState s = current != null ? current : UserRiskState.fresh(userId, today);
            previous[0] = s.dailyLossPercent();
            return s.resetFor(today);
        });
        log.info("Daily loss reset. userId={} was={}", userId, previous[0]);
        return state;
    }

    /**
     * Resets every user whose state still belongs to an earlier UTC day.
     *
     * @return number of users reset
     */
    public int resetAllDailyLoss() {
        String today = dateKey(clock.instant());
        int reset = 0;
        for (String userId : store.userIds()) {
            boolean[] changed = new boolean[1];
            store.updateIfPresent(userId, current -> {
                if (today.equals(current.lastResetDateKey())) {
                    return current;
                }
                changed[0] = true;
                return current.resetFor(today);
            });
            if (changed[0]) {
                reset++;
            }
        }
        log.info("Daily loss reset sweep complete. usersReset={} dateKey={}", reset, today);
        return reset;
    }

    public void clearAllStates() {
        store.clear();
        log.info("Cleared all user risk states");
    }

    public RiskStatistics getStatistics() {
        Instant now = clock.instant();
        int withActive = 0;
        int inCooldown = 0;
        int nearLimit = 0;
        int totalActive = 0;
        for (UserRiskState state : store.snapshot()) {
            if (state.activeTrades() > 0) {
                withActive++;
                totalActive += state.activeTrades();
            }
            if (state.lastLossTimestamp() != null
                    && Duration.between(state.lastLossTimestamp(), now).compareTo(STATISTICS_COOLDOWN_WINDOW) < 0) {
                inCooldown++;
            }
            if (state.dailyLossPercent() > STATISTICS_NEAR_LIMIT_PERCENT) {
                nearLimit++;
            }
        }
        return new RiskStatistics(store.size(), withActive, inCooldown, nearLimit, totalActive);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private UserRiskState ensureCurrent(String userId, UserRiskState current, Instant now) {
        String today = dateKey(now);
        if (current == null) {
            return UserRiskState.fresh(userId, today);
        }
        if (!today.equals(current.lastResetDateKey())) {
            log.info("New UTC day for user, resetting daily loss. userId={} previousDateKey={}",
                userId, current.lastResetDateKey());
            return current.resetFor(today);
        }
        return current;
    }

    static String dateKey(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
    }

    private static void logResult(String userId, double tradeSize, String contextId, RiskCheckResult result) {
        long passed = result.checks().stream().filter(c -> c.passed()).count();
        if (result.allowed()) {
            log.info("Risk check ALLOWED. userId={} tradeSize={} passed={}/{} warnings={} contextId={}",
                userId, tradeSize, passed, result.checks().size(), result.warnings().size(), contextId);
        } else {
            log.warn("Risk check BLOCKED. userId={} tradeSize={} passed={}/{} failures=[{}] contextId={}",
                userId, tradeSize, passed, result.checks().size(), result.failureSummary(), contextId);
        }
    }
}
