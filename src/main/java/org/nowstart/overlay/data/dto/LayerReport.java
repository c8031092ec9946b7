package org.nowstart.overlay.data.dto;

import java.util.List;
import org.nowstart.overlay.data.type.BacktestLayer;

public record LayerReport(
        BacktestLayer layer,
        PortfolioPerformance performance,
        double roiAnnualized,
        double compositeScore,
        int stopTriggers,
        int profitLevelHits,
        int timeExits,
        int endOfDataExits,
        List<TradeOutcome> trades
) {

    public LayerReport {
        trades = trades == null ? List.of() : List.copyOf(trades);
    }
}
