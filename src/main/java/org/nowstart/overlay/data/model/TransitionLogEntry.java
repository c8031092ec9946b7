package org.nowstart.overlay.data.model;

import java.time.Instant;
import org.nowstart.overlay.data.type.RegimeType;

public record TransitionLogEntry(
        Instant recordedAt,
        int day,
        RegimeType previousRegime,
        RegimeType currentRegime,
        double vix,
        Double t2108,
        Double momentumRatio,
        double stopMultiplier,
        double profitMultiplier,
        double urgencyFactor,
        String reason
) {
}
