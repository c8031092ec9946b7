package org.nowstart.overlay.data.model;

import org.nowstart.overlay.data.type.EmergencyProtocol;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Outcome of comparing two snapshots.
 *
 * @param transitionDetected whether the classified regime changed
 * @param previousRegime     regime of the previous snapshot, null when there was none
 * @param currentRegime      regime of the current snapshot
 * @param adjustment         rule adjustment to apply
 * @param emergency          emergency protocol that replaced the base adjustment, null when none fired
 */
public record TransitionResult(
        boolean transitionDetected,
        RegimeType previousRegime,
        RegimeType currentRegime,
        RuleAdjustment adjustment,
        EmergencyProtocol emergency
) {

    public static TransitionResult initial(RegimeType currentRegime) {
        return new TransitionResult(false, null, currentRegime, RuleAdjustment.NEUTRAL, null);
    }

    public boolean emergencyTriggered() {
        return emergency != null;
    }
}
