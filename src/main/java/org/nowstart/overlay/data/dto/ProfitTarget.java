package org.nowstart.overlay.data.dto;

import org.nowstart.overlay.data.type.LevelMethod;

/**
 * One rung of the profit ladder.
 *
 * @param level            zero-based level index
 * @param price            target price
 * @param pct              target distance from entry in percent
 * @param positionToClose  percent of the original position closed at this level
 * @param cumulativeClosed percent of the original position closed once this level is hit
 * @param method           whether the percentage or the True-Range target won
 */
public record ProfitTarget(
        int level,
        double price,
        double pct,
        double positionToClose,
        double cumulativeClosed,
        LevelMethod method
) {
}
