package org.nowstart.overlay.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.nowstart.overlay.data.model.TradePosition;
import org.nowstart.overlay.data.type.PositionState;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Read-only copy of a position for callers outside the lifecycle.
 */
public record PositionView(
        String symbol,
        double entryPrice,
        Instant entryDate,
        double positionSizePct,
        RegimeType regimeAtEntry,
        double vixAtEntry,
        double stopLevel,
        List<Double> profitLevels,
        List<Double> profitScales,
        PositionState state,
        boolean stopTriggered,
        Set<Integer> profitLevelsHit,
        double remainingPositionPct,
        double realizedPnl,
        double maxProfitSeen,
        double maxLossSeen,
        int daysHeld,
        int maxHoldDays
) {

    public static PositionView from(TradePosition position) {
        return new PositionView(
                position.getSymbol(),
                position.getEntryPrice(),
                position.getEntryDate(),
                position.getPositionSizePct(),
                position.getRegimeAtEntry(),
                position.getVixAtEntry(),
                position.getStopLevel(),
                List.copyOf(position.getProfitLevels()),
                List.copyOf(position.getProfitScales()),
                position.getState(),
                position.isStopTriggered(),
                Set.copyOf(position.getProfitLevelsHit()),
                position.getRemainingPositionPct(),
                position.getRealizedPnl(),
                position.getMaxProfitSeen(),
                position.getMaxLossSeen(),
                position.getDaysHeld(),
                position.getMaxHoldDays()
        );
    }
}
