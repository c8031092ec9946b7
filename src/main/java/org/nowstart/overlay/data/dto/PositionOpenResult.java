package org.nowstart.overlay.data.dto;

import java.util.List;
import org.nowstart.overlay.data.type.RegimeType;
import org.nowstart.overlay.data.type.LevelMethod;

public record PositionOpenResult(
        String symbol,
        double entryPrice,
        RegimeType regime,
        double stopLevel,
        double stopDistancePct,
        LevelMethod stopMethod,
        List<ProfitTarget> profitTargets,
        int expectedHoldDays,
        boolean transitionDetected,
        String adjustmentReason
) {
}
