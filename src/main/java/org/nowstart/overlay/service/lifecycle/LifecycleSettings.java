package org.nowstart.overlay.service.lifecycle;

import org.nowstart.overlay.data.property.RiskOverlayProperties;
import org.nowstart.overlay.service.rule.TrueRangeHistory;

public record LifecycleSettings(
        double defaultPositionSizePct,
        double defaultTrueRangeFraction,
        int trueRangeWindow,
        double regimeCheckVixDelta
) {

    public static LifecycleSettings defaults() {
        return new LifecycleSettings(100.0, 0.02, TrueRangeHistory.DEFAULT_WINDOW, 15.0);
    }

    public static LifecycleSettings from(RiskOverlayProperties properties) {
        return new LifecycleSettings(
                properties.defaultPositionSizePct(),
                properties.defaultTrueRangeFraction(),
                properties.trueRangeWindow(),
                properties.regimeCheckVixDelta()
        );
    }
}
