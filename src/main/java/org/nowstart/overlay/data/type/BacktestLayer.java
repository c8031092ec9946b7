package org.nowstart.overlay.data.type;

import java.util.Locale;

public enum BacktestLayer {
    BASELINE,
    STOP_LOSS_ONLY,
    PROFIT_TAKING_ONLY,
    COMBINED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
