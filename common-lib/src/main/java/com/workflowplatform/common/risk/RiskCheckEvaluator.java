package com.workflowplatform.common.risk;

import com.workflowplatform.common.model.RiskControlConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure risk-limit checks. No I/O, no state, no logging: the caller owns the user state
 * and the clock.
 *
 * <p>All five checks are always evaluated so callers see the complete picture.
 * A passing check above {@value #WARNING_RATIO} of its limit is reported as a warning.
 */
public final class RiskCheckEvaluator {

    static final double WARNING_RATIO = 0.8;

    private RiskCheckEvaluator() {}

    public static RiskCheckResult evaluate(UserRiskState state, double tradeSize, double portfolioValue,
                                           RiskControlConfig config, Instant now) {
        List<RiskCheck> checks = List.of(
            positionSize(tradeSize, portfolioValue, config),
            dailyLoss(state, config),
            concurrentTrades(state, config),
            cooldown(state, config, now),
            maxLossPerTrade(tradeSize, portfolioValue, config)
        );

        List<String> warnings = new ArrayList<>();
        for (RiskCheck check : checks) {
            if (check.passed() && check.severity() == RiskSeverity.WARNING) {
                warnings.add(check.type().value() + ": " + check.reason());
            }
        }
        boolean allowed = checks.stream().allMatch(RiskCheck::passed);
        return new RiskCheckResult(allowed, checks, List.copyOf(warnings), now);
    }

    public static RiskCheck positionSize(double tradeSize, double portfolioValue, RiskControlConfig config) {
        return sizeCheck(RiskCheckType.POSITION_SIZE, "Position size", tradeSize, portfolioValue,
            config.maxPositionSize());
    }

    /** Worst case: the whole trade size is lost. */
    public static RiskCheck maxLossPerTrade(double tradeSize, double portfolioValue, RiskControlConfig config) {
        return sizeCheck(RiskCheckType.MAX_LOSS_PER_TRADE, "Potential loss", tradeSize, portfolioValue,
            config.maxLossPerTrade());
    }

    private static RiskCheck sizeCheck(RiskCheckType type, String label, double tradeSize,
                                       double portfolioValue, double limit) {
        if (portfolioValue <= 0 || Double.isNaN(portfolioValue) || Double.isNaN(tradeSize)) {
            return new RiskCheck(type, false,
                "Portfolio value " + portfolioValue + " is not positive", null, limit, RiskSeverity.CRITICAL);
        }
        double percent = tradeSize / portfolioValue * 100.0;
        boolean passed = percent <= limit;
        String reason = passed
            ? String.format(Locale.ROOT, "%s %.2f%% is within limit", label, percent)
            : String.format(Locale.ROOT, "%s %.2f%% exceeds limit of %s%%", label, percent, limit);
        return new RiskCheck(type, passed, reason, percent, limit, severity(passed, percent > limit * WARNING_RATIO));
    }

    public static RiskCheck dailyLoss(UserRiskState state, RiskControlConfig config) {
        double loss = state.dailyLossPercent();
        double limit = config.maxDailyLoss();
        boolean passed = loss < limit;
        String reason = passed
            ? String.format(Locale.ROOT, "Daily loss %.2f%% is within limit", loss)
            : String.format(Locale.ROOT, "Daily loss %.2f%% exceeds limit of %s%%", loss, limit);
        return new RiskCheck(RiskCheckType.DAILY_LOSS, passed, reason, loss, limit,
            severity(passed, loss > limit * WARNING_RATIO));
    }

    public static RiskCheck concurrentTrades(UserRiskState state, RiskControlConfig config) {
        int active = state.activeTrades();
        int limit = config.maxConcurrentTrades();
        boolean passed = active < limit;
        String reason = passed
            ? "Active trades " + active + " is within limit"
            : "Active trades " + active + " exceeds limit of " + limit;
        return new RiskCheck(RiskCheckType.CONCURRENT_TRADES, passed, reason, (double) active, (double) limit,
            severity(passed, active >= limit * WARNING_RATIO));
    }

    /**
     * Fails while the last loss is younger than {@code cooldownPeriod} seconds and the day is
     * still net-negative. Always WARNING severity when failing.
     */
    public static RiskCheck cooldown(UserRiskState state, RiskControlConfig config, Instant now) {
        if (state.lastLossTimestamp() == null || state.dailyLossPercent() <= 0) {
            return new RiskCheck(RiskCheckType.COOLDOWN, true, "No cooldown required", null, null,
                RiskSeverity.INFO);
        }
        long sinceLossMs = Duration.between(state.lastLossTimestamp(), now).toMillis();
        long cooldownMs = config.cooldownPeriod() * 1000L;
        boolean passed = sinceLossMs >= cooldownMs;
        long remainingSeconds = (long) Math.ceil((cooldownMs - sinceLossMs) / 1000.0);
        String reason = passed
            ? "Cooldown period completed"
            : "Cooldown period active: " + remainingSeconds + "s remaining";
        return new RiskCheck(RiskCheckType.COOLDOWN, passed, reason, sinceLossMs / 1000.0,
            (double) config.cooldownPeriod(), passed ? RiskSeverity.INFO : RiskSeverity.WARNING);
    }

    private static RiskSeverity severity(boolean passed, boolean nearLimit) {
        if (!passed) {
            return RiskSeverity.CRITICAL;
        }
        return nearLimit ? RiskSeverity.WARNING : RiskSeverity.INFO;
    }
}
