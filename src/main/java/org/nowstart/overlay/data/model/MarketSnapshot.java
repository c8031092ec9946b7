package org.nowstart.overlay.data.model;

/**
 * One observation of the market-volatility context.
 *
 * @param vix           volatility index level
 * @param t2108         breadth percentile (0-100), optional
 * @param momentumRatio daily momentum ratio (positive), optional
 * @param day           sequence index of the observation
 */
public record MarketSnapshot(
        double vix,
        Double t2108,
        Double momentumRatio,
        int day
) {

    public static MarketSnapshot of(double vix) {
        return new MarketSnapshot(vix, null, null, 0);
    }

    public static MarketSnapshot of(double vix, Double t2108, Double momentumRatio) {
        return new MarketSnapshot(vix, t2108, momentumRatio, 0);
    }

    public MarketSnapshot withDay(int newDay) {
        return new MarketSnapshot(vix, t2108, momentumRatio, newDay);
    }

    public boolean hasBreadth() {
        return t2108 != null;
    }

    public boolean hasMomentum() {
        return momentumRatio != null;
    }
}
