package org.nowstart.overlay.service.lifecycle;

/**
 * Which rule layers a lifecycle enforces.
 *
 * @param stopLoss         exit on the stop level
 * @param profitTaking     scale out on the profit ladder
 * @param regimeAdjustment detect transitions on open and re-adjust the stop while holding
 * @param fixedHoldDays    time-exit horizon that overrides the regime hold days, null to use the regime's
 */
public record LifecycleRules(
        boolean stopLoss,
        boolean profitTaking,
        boolean regimeAdjustment,
        Integer fixedHoldDays
) {

    public LifecycleRules {
        if (fixedHoldDays != null && fixedHoldDays < 1) {
            throw new IllegalArgumentException("fixedHoldDays must be >= 1");
        }
    }

    public static LifecycleRules full() {
        return new LifecycleRules(true, true, true, null);
    }

    public static LifecycleRules baseline(int holdDays) {
        return new LifecycleRules(false, false, false, holdDays);
    }

    public static LifecycleRules stopLossOnly(int holdDays) {
        return new LifecycleRules(true, false, false, holdDays);
    }

    public static LifecycleRules profitTakingOnly(int holdDays) {
        return new LifecycleRules(false, true, false, holdDays);
    }
}
