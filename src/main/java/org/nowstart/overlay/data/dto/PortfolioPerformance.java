package org.nowstart.overlay.data.dto;

/**
 * Aggregated statistics over closed-trade returns. All returns are fractions (0.05 = 5%).
 *
 * @param sharpeRatio     mean / population stdev, annualized by sqrt(252/5)
 * @param currentDrawdown drawdown of the last equity point from its running max (<= 0)
 * @param maxDrawdown     deepest drawdown of the equity curve (<= 0)
 * @param annualizedRoi   average return per trade scaled by 252/5 five-day holds
 */
public record PortfolioPerformance(
        int totalTrades,
        double totalReturn,
        double avgReturnPerTrade,
        double winRate,
        double maxWin,
        double maxLoss,
        double sharpeRatio,
        double currentDrawdown,
        double maxDrawdown,
        double volatility,
        double annualizedRoi
) {

    public static PortfolioPerformance empty() {
        return new PortfolioPerformance(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
