package org.nowstart.overlay.data.dto;

import java.util.List;
import org.nowstart.overlay.data.type.PositionState;

/**
 * @param currentPnl mark-to-market return at the daily close, null once the position is closed
 */
public record PositionUpdateResult(
        String symbol,
        List<PositionAction> actions,
        PositionState status,
        Double currentPnl,
        double realizedPnl,
        double remainingPct,
        int daysHeld,
        double maxProfitSeen,
        double maxLossSeen
) {

    public PositionUpdateResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
