package org.nowstart.overlay.data.type;

/**
 * Hard overrides that replace the regular transition adjustment on extreme single-step moves.
 */
public enum EmergencyProtocol {
    BREADTH_COLLAPSE(0.6, 0.7, 2.0, "EMERGENCY: Breadth collapse protocol activated"),
    VOLATILITY_EXPLOSION(1.5, 1.4, 0.7, "EMERGENCY: Volatility explosion protocol activated"),
    MOMENTUM_COLLAPSE(0.5, 0.6, 3.0, "EMERGENCY: Momentum collapse protocol activated");

    private final double stopMultiplier;
    private final double profitMultiplier;
    private final double urgencyFactor;
    private final String reason;

    EmergencyProtocol(double stopMultiplier, double profitMultiplier, double urgencyFactor, String reason) {
        this.stopMultiplier = stopMultiplier;
        this.profitMultiplier = profitMultiplier;
        this.urgencyFactor = urgencyFactor;
        this.reason = reason;
    }

    public double stopMultiplier() {
        return stopMultiplier;
    }

    public double profitMultiplier() {
        return profitMultiplier;
    }

    public double urgencyFactor() {
        return urgencyFactor;
    }

    public String reason() {
        return reason;
    }
}
