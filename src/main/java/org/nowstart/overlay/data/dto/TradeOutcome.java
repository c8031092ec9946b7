package org.nowstart.overlay.data.dto;

import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * How one historical trade ended in one backtest layer.
 */
public record TradeOutcome(
        String symbol,
        RegimeType regime,
        double realizedReturn,
        int daysHeld,
        PositionActionType exitReason,
        int profitLevelsHit,
        boolean stopTriggered,
        double remainingPct
) {
}
