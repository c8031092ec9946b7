package org.nowstart.overlay.service.performance;

import java.util.List;
import org.nowstart.overlay.data.dto.PortfolioPerformance;
import org.springframework.stereotype.Component;

/**
 * Reduces closed-trade returns (fractions) to portfolio statistics. The Sharpe-like ratio assumes
 * roughly five-day holds and uses the population standard deviation.
 */
@Component
public class PerformanceAggregator {

    static final double TRADING_DAYS = 252.0;
    static final double HOLD_DAYS = 5.0;
    static final double SHARPE_ANNUALIZATION = Math.sqrt(TRADING_DAYS / HOLD_DAYS);

    public PortfolioPerformance aggregate(List<Double> returns) {
        if (returns == null || returns.isEmpty()) {
            return PortfolioPerformance.empty();
        }

        int n = returns.size();
        double total = 0.0;
        double maxWin = Double.NEGATIVE_INFINITY;
        double maxLoss = Double.POSITIVE_INFINITY;
        int wins = 0;
        for (double value : returns) {
            total += value;
            maxWin = Math.max(maxWin, value);
            maxLoss = Math.min(maxLoss, value);
            if (value > 0.0) {
                wins++;
            }
        }
        double mean = total / n;

        double squared = 0.0;
        for (double value : returns) {
            squared += (value - mean) * (value - mean);
        }
        double stdev = Math.sqrt(squared / n);
        double sharpe = stdev > 0.0 ? mean / stdev * SHARPE_ANNUALIZATION : 0.0;

        double[] drawdown = drawdowns(returns);

        return new PortfolioPerformance(
                n,
                total,
                mean,
                (double) wins / n,
                maxWin,
                maxLoss,
                sharpe,
                drawdown[0],
                drawdown[1],
                stdev,
                mean * TRADING_DAYS / HOLD_DAYS
        );
    }

    /**
     * Composite ranking score: {@code roi / |maxDrawdown| * sharpe} when both drawdown and Sharpe are
     * positive, plain {@code roi} otherwise.
     */
    public double compositeScore(double roiAnnualized, double maxDrawdown, double sharpeRatio) {
        double drawdown = Math.abs(maxDrawdown);
        if (drawdown > 0.0 && sharpeRatio > 0.0) {
            return roiAnnualized / drawdown * sharpeRatio;
        }
        return roiAnnualized;
    }

    // [current, max] drawdown of the compounded equity curve
    private double[] drawdowns(List<Double> returns) {
        double equity = 1.0;
        double runningMax = Double.NEGATIVE_INFINITY;
        double current = 0.0;
        double max = 0.0;
        for (double value : returns) {
            equity *= 1.0 + value;
            runningMax = Math.max(runningMax, equity);
            current = runningMax > 0.0 ? (equity - runningMax) / runningMax : 0.0;
            max = Math.min(max, current);
        }
        return new double[] {current, max};
    }
}
