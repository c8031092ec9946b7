package org.nowstart.overlay.data.model;

import org.nowstart.overlay.data.type.RegimeType;

/**
 * Half-open VIX band boundaries: [0, lowVolUpper) low-vol, [lowVolUpper, bullNormalUpper) bull,
 * [bullNormalUpper, highVolUpper) high-vol stress, [highVolUpper, inf) crisis.
 */
public record RegimeBands(
        double lowVolUpper,
        double bullNormalUpper,
        double highVolUpper
) {

    public static final RegimeBands DEFAULT = new RegimeBands(15.0, 30.0, 50.0);

    public RegimeBands {
        if (!Double.isFinite(lowVolUpper) || !Double.isFinite(bullNormalUpper) || !Double.isFinite(highVolUpper)) {
            throw new IllegalArgumentException("regime band boundaries must be finite");
        }
        if (lowVolUpper <= 0.0 || lowVolUpper >= bullNormalUpper || bullNormalUpper >= highVolUpper) {
            throw new IllegalArgumentException(
                    "regime band boundaries must be strictly ascending and positive, got "
                            + lowVolUpper + "/" + bullNormalUpper + "/" + highVolUpper
            );
        }
    }

    public RegimeType primaryRegime(double vix) {
        if (vix >= highVolUpper) {
            return RegimeType.CRISIS_OPPORTUNITY;
        }
        if (vix >= bullNormalUpper) {
            return RegimeType.HIGH_VOL_STRESS;
        }
        if (vix >= lowVolUpper) {
            return RegimeType.BULL_NORMAL;
        }
        return RegimeType.LOW_VOL_COMPLACENCY;
    }
}
