package org.nowstart.overlay.data.type;

import java.util.Locale;

/**
 * Market-stress regimes in ascending VIX-band order.
 */
public enum RegimeType {
    LOW_VOL_COMPLACENCY,
    BULL_NORMAL,
    HIGH_VOL_STRESS,
    CRISIS_OPPORTUNITY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public RegimeType escalate() {
        return switch (this) {
            case LOW_VOL_COMPLACENCY -> BULL_NORMAL;
            case BULL_NORMAL -> HIGH_VOL_STRESS;
            case HIGH_VOL_STRESS, CRISIS_OPPORTUNITY -> this;
        };
    }

    public RegimeType deescalate() {
        return switch (this) {
            case HIGH_VOL_STRESS -> BULL_NORMAL;
            case BULL_NORMAL -> LOW_VOL_COMPLACENCY;
            case LOW_VOL_COMPLACENCY, CRISIS_OPPORTUNITY -> this;
        };
    }
}
