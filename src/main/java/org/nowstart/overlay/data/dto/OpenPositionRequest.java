package org.nowstart.overlay.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record OpenPositionRequest(
        @NotBlank(message = "symbol is required")
        String symbol,
        @NotNull(message = "entryPrice is required")
        @Positive(message = "entryPrice must be greater than zero")
        Double entryPrice,
        @NotNull(message = "market is required")
        @Valid
        MarketSnapshotRequest market,
        @DecimalMin(value = "0", inclusive = false, message = "positionSizePct must be greater than zero")
        @DecimalMax(value = "100", message = "positionSizePct must be <= 100")
        Double positionSizePct,
        @Positive(message = "trueRange must be greater than zero")
        Double trueRange
) {
}
