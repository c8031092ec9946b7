package org.nowstart.overlay.data.dto;

import java.util.List;

/**
 * Per-request overrides of the backtest defaults. Every field is optional.
 *
 * @param baselineHoldDays fixed exit horizon of the isolated layers
 * @param vixBands         three ascending VIX band boundaries
 * @param stopScalar       multiplier applied to every stop rule
 * @param profitScalar     multiplier applied to every profit rule
 * @param gridSearch       whether to run the parameter grid after the layers
 */
public record BacktestOverrides(
        Integer baselineHoldDays,
        List<Double> vixBands,
        Double stopScalar,
        Double profitScalar,
        Boolean gridSearch
) {

    public static BacktestOverrides none() {
        return new BacktestOverrides(null, null, null, null, null);
    }

    public boolean gridSearchEnabled() {
        return Boolean.TRUE.equals(gridSearch);
    }
}
