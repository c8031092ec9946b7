package org.nowstart.overlay.data.dto;

import java.util.List;
import java.util.Map;
import org.nowstart.overlay.data.type.BacktestLayer;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Comparative report of all backtest layers.
 *
 * @param roiImprovement    combined annualized ROI minus baseline annualized ROI
 * @param drawdownReduction baseline max drawdown minus combined max drawdown, positive when the overlay helped
 * @param regimeBreakdown   combined-layer statistics per entry regime
 * @param gridSearch        best grid candidates first, empty when the grid was not requested
 */
public record BacktestReport(
        int totalTrades,
        Map<BacktestLayer, LayerReport> layers,
        BacktestLayer bestLayer,
        double roiImprovement,
        double drawdownReduction,
        Map<RegimeType, RegimeBreakdown> regimeBreakdown,
        List<GridSearchRow> gridSearch
) {

    public BacktestReport {
        gridSearch = gridSearch == null ? List.of() : List.copyOf(gridSearch);
    }
}
