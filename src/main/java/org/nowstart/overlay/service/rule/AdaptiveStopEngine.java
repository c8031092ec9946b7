package org.nowstart.overlay.service.rule;

import org.nowstart.overlay.data.dto.StopLossResult;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.type.LevelMethod;
import org.springframework.stereotype.Component;

/**
 * Stop level from the more conservative of the percentage rule and the volatility-normalised
 * True-Range rule, adjusted for breadth and clamped to [-25%, -2%].
 */
@Component
public class AdaptiveStopEngine {

    static final double WIDEST_STOP_PCT = -25.0;
    static final double TIGHTEST_STOP_PCT = -2.0;
    static final double WEAK_BREADTH = 20.0;
    static final double STRONG_BREADTH = 60.0;
    static final double WEAK_BREADTH_FACTOR = 0.8;
    static final double STRONG_BREADTH_FACTOR = 1.2;

    public StopLossResult compute(double entryPrice, RegimeConfig config, double currentTrueRange, Double t2108) {
        return compute(entryPrice, config, currentTrueRange, t2108, null);
    }

    /**
     * @param history rolling True-Range window of the symbol, already holding the current observation;
     *                null means no history and a volatility factor of 1
     */
    public StopLossResult compute(
            double entryPrice,
            RegimeConfig config,
            double currentTrueRange,
            Double t2108,
            TrueRangeHistory history
    ) {
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            throw new InvalidInputException("entryPrice must be a finite positive number, got " + entryPrice);
        }
        if (!Double.isFinite(currentTrueRange) || currentTrueRange < 0.0) {
            throw new InvalidInputException("trueRange must be a finite non-negative number, got " + currentTrueRange);
        }

        double volatilityFactor = history == null ? 1.0 : history.volatilityFactor(currentTrueRange);
        double basePct = config.stopLossPct();
        double trPct = -(currentTrueRange * config.trStopMultiplier() * volatilityFactor / entryPrice) * 100.0;

        double finalPct = Math.min(basePct, trPct);
        if (t2108 != null) {
            if (t2108 < WEAK_BREADTH) {
                finalPct *= WEAK_BREADTH_FACTOR;
            } else if (t2108 > STRONG_BREADTH) {
                finalPct *= STRONG_BREADTH_FACTOR;
            }
        }
        finalPct = clamp(finalPct);

        return new StopLossResult(
                entryPrice * (1.0 + finalPct / 100.0),
                finalPct,
                trPct < basePct ? LevelMethod.TR_BASED : LevelMethod.PCT_BASED,
                basePct,
                trPct,
                volatilityFactor
        );
    }

    public static double clamp(double stopPct) {
        return Math.max(WIDEST_STOP_PCT, Math.min(TIGHTEST_STOP_PCT, stopPct));
    }
}
