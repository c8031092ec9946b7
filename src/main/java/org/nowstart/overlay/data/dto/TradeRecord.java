package org.nowstart.overlay.data.dto;

import java.time.Instant;
import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Closed trade as kept in the trade history.
 *
 * @param realizedReturn total realized return as a fraction of the full position
 */
public record TradeRecord(
        String symbol,
        double entryPrice,
        double exitPrice,
        Instant entryDate,
        Instant closedAt,
        RegimeType regimeAtEntry,
        double realizedReturn,
        int daysHeld,
        PositionActionType exitReason,
        int profitLevelsHit,
        boolean stopTriggered,
        double maxProfitSeen,
        double maxLossSeen
) {
}
