package org.nowstart.overlay.data.dto;

import java.util.List;

/**
 * One evaluated grid candidate of the combined layer.
 */
public record GridSearchRow(
        List<Double> vixBands,
        double stopScalar,
        double profitScalar,
        double compositeScore,
        double roiAnnualized,
        double maxDrawdown,
        double sharpeRatio,
        double totalReturn
) {

    public GridSearchRow {
        vixBands = List.copyOf(vixBands);
    }
}
