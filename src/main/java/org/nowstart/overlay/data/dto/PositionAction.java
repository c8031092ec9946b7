package org.nowstart.overlay.data.dto;

import org.nowstart.overlay.data.type.PositionActionType;

/**
 * One executed action of a daily update.
 *
 * @param type              action kind
 * @param level             zero-based profit level for {@code PROFIT_TAKING}, -1 otherwise
 * @param price             execution price, or the new stop level for {@code REGIME_ADJUSTMENT}
 * @param positionClosedPct percent of the original position closed by this action
 * @param pnl               realized PnL contribution as a fraction of the full position
 * @param reason            human-readable trace
 */
public record PositionAction(
        PositionActionType type,
        int level,
        double price,
        double positionClosedPct,
        double pnl,
        String reason
) {
}
