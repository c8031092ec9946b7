package org.nowstart.overlay.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record BacktestRequest(
        @NotEmpty(message = "trades must not be empty")
        List<@Valid HistoricalTrade> trades,
        BacktestOverrides overrides
) {
}
