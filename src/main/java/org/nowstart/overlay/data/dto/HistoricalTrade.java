package org.nowstart.overlay.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * A trade replayed by the backtester: entry context followed by the daily bars after entry.
 *
 * @param trueRange True Range at entry, null to fall back to the configured fraction of entry price
 */
public record HistoricalTrade(
        @NotBlank(message = "symbol is required")
        String symbol,
        @Positive(message = "entryPrice must be greater than zero")
        double entryPrice,
        @DecimalMin(value = "5", message = "vixAtEntry must be >= 5")
        @DecimalMax(value = "100", message = "vixAtEntry must be <= 100")
        double vixAtEntry,
        Double t2108,
        Double momentumRatio,
        Double trueRange,
        List<@Valid DailyBar> bars
) {

    public HistoricalTrade {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }
}
