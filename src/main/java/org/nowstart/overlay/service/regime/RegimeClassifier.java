package org.nowstart.overlay.service.regime;

import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeBands;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Maps a market snapshot to a regime: primary VIX band, then at most one step of breadth/momentum
 * adjustment. Out-of-range inputs are classified as-is; range checks belong to the caller.
 */
public class RegimeClassifier {

    static final double WEAK_BREADTH = 20.0;
    static final double WEAK_MOMENTUM = 0.8;
    static final double STRONG_BREADTH = 60.0;
    static final double STRONG_MOMENTUM = 2.0;
    static final double LOW_VOL_DEESCALATION_VIX = 20.0;

    private final RegimeBands bands;

    public RegimeClassifier() {
        this(RegimeBands.DEFAULT);
    }

    public RegimeClassifier(RegimeBands bands) {
        if (bands == null) {
            throw new IllegalArgumentException("bands are required");
        }
        this.bands = bands;
    }

    public RegimeBands bands() {
        return bands;
    }

    public RegimeType classify(MarketSnapshot snapshot) {
        return classify(snapshot.vix(), snapshot.t2108(), snapshot.momentumRatio());
    }

    public RegimeType classify(double vix, Double t2108, Double momentumRatio) {
        RegimeType primary = bands.primaryRegime(vix);
        if (t2108 == null || momentumRatio == null) {
            return primary;
        }

        if (t2108 < WEAK_BREADTH && momentumRatio < WEAK_MOMENTUM) {
            return primary.escalate();
        }
        if (t2108 > STRONG_BREADTH && momentumRatio > STRONG_MOMENTUM) {
            if (primary == RegimeType.BULL_NORMAL && vix >= LOW_VOL_DEESCALATION_VIX) {
                return primary;
            }
            return primary.deescalate();
        }
        return primary;
    }
}
