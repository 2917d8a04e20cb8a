package com.workflowplatform.orchestrator.gate;

import com.workflowplatform.common.decision.FieldPathResolver;
import com.workflowplatform.common.decision.NumberCoercion;
import com.workflowplatform.common.risk.TradeResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reads trade figures out of free-form stage output. The first numeric value found along
 * the listed paths wins.
 *
 * <ul>
 *   <li>trade size: {@code tradeSize}, {@code positionSize}, {@code signal.amount}, {@code amount},
 *       else {@code signal.quantity × signal.price}, else 0</li>
 *   <li>portfolio value: {@code portfolioValue}, {@code portfolio.totalValue}, else the configured default</li>
 *   <li>P&amp;L: {@code profitLoss}, {@code pnl.realized}; percent: {@code profitLossPercentage},
 *       {@code profitLossPercent}, {@code pnl.realizedPercent}; missing values are 0</li>
 * </ul>
 */
public class TradeMetricsExtractor {

    private static final List<String> TRADE_SIZE_PATHS =
        List.of("tradeSize", "positionSize", "signal.amount", "amount");
    private static final List<String> PORTFOLIO_VALUE_PATHS =
        List.of("portfolioValue", "portfolio.totalValue");
    private static final List<String> PROFIT_LOSS_PATHS =
        List.of("profitLoss", "pnl.realized");
    private static final List<String> PROFIT_LOSS_PERCENT_PATHS =
        List.of("profitLossPercentage", "profitLossPercent", "pnl.realizedPercent");

    private final double defaultPortfolioValue;

    public TradeMetricsExtractor(double defaultPortfolioValue) {
        this.defaultPortfolioValue = defaultPortfolioValue;
    }

    public double tradeSize(Map<String, Object> data) {
        Double direct = firstNumeric(data, TRADE_SIZE_PATHS);
        if (direct != null) {
            return direct;
        }
        double quantity = NumberCoercion.toDouble(FieldPathResolver.resolve(data, "signal.quantity"));
        double price = NumberCoercion.toDouble(FieldPathResolver.resolve(data, "signal.price"));
        if (!Double.isNaN(quantity) && !Double.isNaN(price)) {
            return quantity * price;
        }
        return 0.0;
    }

    public double portfolioValue(Map<String, Object> data) {
        Double value = firstNumeric(data, PORTFOLIO_VALUE_PATHS);
        return value != null ? value : defaultPortfolioValue;
    }

    public TradeResult tradeResult(String userId, String executionId, Map<String, Object> data, Instant now) {
        Double profitLoss = firstNumeric(data, PROFIT_LOSS_PATHS);
        Double percent = firstNumeric(data, PROFIT_LOSS_PERCENT_PATHS);
        return new TradeResult(
            userId,
            profitLoss != null ? profitLoss : 0.0,
            percent != null ? percent : 0.0,
            tradeSize(data),
            now,
            executionId);
    }

    private static Double firstNumeric(Map<String, Object> data, List<String> paths) {
        if (data == null) {
            return null;
        }
        for (String path : paths) {
            double value = NumberCoercion.toDouble(FieldPathResolver.resolve(data, path));
            if (!Double.isNaN(value)) {
                return value;
            }
        }
        return null;
    }
}
