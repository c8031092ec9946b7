package org.nowstart.overlay.data.dto;

import org.nowstart.overlay.data.type.LevelMethod;

/**
 * @param price            stop price
 * @param pct              final stop distance in percent (negative, within [-25, -2])
 * @param method           which rule produced the more conservative stop
 * @param basePct          percentage-rule stop before breadth adjustment and clamping
 * @param trPct            volatility-rule stop before breadth adjustment and clamping
 * @param volatilityFactor current True Range over its rolling mean
 */
public record StopLossResult(
        double price,
        double pct,
        LevelMethod method,
        double basePct,
        double trPct,
        double volatilityFactor
) {
}
