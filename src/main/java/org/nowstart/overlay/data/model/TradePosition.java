package org.nowstart.overlay.data.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.overlay.data.type.PositionState;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Mutable state of one position. Owned and mutated exclusively by the position lifecycle.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradePosition {

    private static final double REMAINING_EPSILON = 1e-9;

    private String symbol;

    private double entryPrice;

    private Instant entryDate;

    private double positionSizePct;

    private RegimeType regimeAtEntry;

    private double vixAtEntry;

    private double stopLevel;

    private List<Double> profitLevels;

    // cumulative close percentages, last element is 100
    private List<Double> profitScales;

    @Builder.Default
    private PositionState state = PositionState.OPEN;

    private boolean stopTriggered;

    @Builder.Default
    private Set<Integer> profitLevelsHit = new TreeSet<>();

    @Builder.Default
    private double remainingPositionPct = 100.0;

    private double realizedPnl;

    private double maxProfitSeen;

    private double maxLossSeen;

    private int daysHeld;

    private int maxHoldDays;

    private MarketSnapshot referenceSnapshot;

    private double lastClose;

    public double positionToClose(int level) {
        double previous = level == 0 ? 0.0 : profitScales.get(level - 1);
        return profitScales.get(level) - previous;
    }

    public double returnAt(double price) {
        return (price - entryPrice) / entryPrice;
    }

    public boolean isClosed() {
        return state == PositionState.CLOSED;
    }

    /**
     * Realizes PnL on {@code closedPct} percent of the original position at {@code price}.
     *
     * @return realized PnL contribution as a fraction of the full position
     */
    public double realize(double price, double closedPct) {
        double pnl = returnAt(price) * (closedPct / 100.0);
        realizedPnl += pnl;
        remainingPositionPct = remainingPositionPct - closedPct;
        if (remainingPositionPct < REMAINING_EPSILON) {
            remainingPositionPct = 0.0;
        }
        return pnl;
    }

    public void trackExcursion(double high, double low) {
        maxProfitSeen = Math.max(maxProfitSeen, returnAt(high));
        maxLossSeen = Math.min(maxLossSeen, returnAt(low));
    }
}
