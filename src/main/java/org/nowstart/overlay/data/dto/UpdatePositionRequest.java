package org.nowstart.overlay.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record UpdatePositionRequest(
        @NotNull(message = "high is required")
        @Positive(message = "high must be greater than zero")
        Double high,
        @NotNull(message = "low is required")
        @Positive(message = "low must be greater than zero")
        Double low,
        @NotNull(message = "close is required")
        @Positive(message = "close must be greater than zero")
        Double close,
        @NotNull(message = "market is required")
        @Valid
        MarketSnapshotRequest market
) {
}
