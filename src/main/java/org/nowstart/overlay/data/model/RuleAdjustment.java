package org.nowstart.overlay.data.model;

/**
 * Multiplicative rule change derived from a regime transition.
 *
 * <p>Multipliers compose by product, urgency by max, reasons by concatenation.
 */
public record RuleAdjustment(
        double stopMultiplier,
        double profitMultiplier,
        double urgencyFactor,
        String reason
) {

    public static final RuleAdjustment NEUTRAL = new RuleAdjustment(1.0, 1.0, 1.0, "");

    public RuleAdjustment {
        reason = reason == null ? "" : reason;
    }

    public RuleAdjustment scale(double stopFactor, double profitFactor, String cause) {
        return new RuleAdjustment(
                stopMultiplier * stopFactor,
                profitMultiplier * profitFactor,
                urgencyFactor,
                appendReason(reason, cause)
        );
    }

    public RuleAdjustment withMinimumUrgency(double urgency) {
        return new RuleAdjustment(stopMultiplier, profitMultiplier, Math.max(urgencyFactor, urgency), reason);
    }

    public boolean isTrivial() {
        return reason.isBlank()
                && stopMultiplier == 1.0
                && profitMultiplier == 1.0
                && urgencyFactor == 1.0;
    }

    /**
     * Applies this adjustment to a rule bundle. Position scaling is never changed; hold days shrink
     * only when urgency exceeds 1.
     */
    public RegimeConfig applyTo(RegimeConfig config) {
        int maxHoldDays = config.maxHoldDays();
        if (urgencyFactor > 1.0) {
            maxHoldDays = adjustHoldDays(maxHoldDays);
        }
        return new RegimeConfig(
                config.stopLossPct() * stopMultiplier,
                config.profitLevelsPct().stream().map(level -> level * profitMultiplier).toList(),
                config.positionScalingPct(),
                config.trStopMultiplier() * stopMultiplier,
                config.trProfitMultipliers().stream().map(mult -> mult * profitMultiplier).toList(),
                maxHoldDays,
                config.description()
        );
    }

    public int adjustHoldDays(int maxHoldDays) {
        if (urgencyFactor <= 1.0) {
            return maxHoldDays;
        }
        return Math.max(1, (int) Math.floor(maxHoldDays / urgencyFactor));
    }

    private static String appendReason(String current, String cause) {
        if (cause == null || cause.isBlank()) {
            return current;
        }
        if (current.isBlank()) {
            return cause;
        }
        return current + "; " + cause;
    }
}
