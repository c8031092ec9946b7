package org.nowstart.overlay.data.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.nowstart.overlay.data.model.MarketSnapshot;

public record MarketSnapshotRequest(
        @NotNull(message = "vix is required")
        @DecimalMin(value = "5", message = "vix must be >= 5")
        @DecimalMax(value = "100", message = "vix must be <= 100")
        Double vix,
        @DecimalMin(value = "0", message = "t2108 must be >= 0")
        @DecimalMax(value = "100", message = "t2108 must be <= 100")
        Double t2108,
        @Positive(message = "momentumRatio must be greater than zero")
        Double momentumRatio,
        Integer day
) {

    public MarketSnapshot toSnapshot() {
        return new MarketSnapshot(vix, t2108, momentumRatio, day == null ? 0 : day);
    }
}
