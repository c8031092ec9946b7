package org.nowstart.overlay.service.regime;

import java.time.Clock;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.model.RuleAdjustment;
import org.nowstart.overlay.data.model.TransitionLogEntry;
import org.nowstart.overlay.data.model.TransitionResult;
import org.nowstart.overlay.data.type.EmergencyProtocol;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Compares two snapshots and derives a multiplicative rule adjustment from the raw VIX, breadth and
 * momentum deltas. An emergency protocol, when one fires, replaces the base adjustment entirely.
 */
@Slf4j
public class RegimeTransitionManager {

    static final double VIX_MAJOR_CHANGE = 15.0;
    static final double BREADTH_COLLAPSE = -25.0;
    static final double BREADTH_SURGE = 20.0;
    static final double MOMENTUM_COLLAPSE_RATIO = 0.5;
    static final double MOMENTUM_SURGE_RATIO = 2.0;

    static final double EMERGENCY_BREADTH_DROP = -30.0;
    static final double EMERGENCY_VIX_LEVEL = 60.0;
    static final double EMERGENCY_VIX_JUMP = 20.0;
    static final double EMERGENCY_MOMENTUM_FLOOR = 0.1;
    static final double EMERGENCY_MOMENTUM_PRIOR = 1.0;

    private final RegimeClassifier classifier;
    private final Clock clock;

    public RegimeTransitionManager(RegimeClassifier classifier) {
        this(classifier, Clock.systemUTC());
    }

    public RegimeTransitionManager(RegimeClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock = clock;
    }

    public RegimeClassifier classifier() {
        return classifier;
    }

    public TransitionResult detect(MarketSnapshot current, MarketSnapshot previous) {
        return detect(current, previous, null);
    }

    /**
     * Detects a transition between {@code previous} and {@code current}. A missing previous snapshot
     * means no transition and a neutral adjustment. Detected transitions and fired emergencies are
     * appended to {@code transitionLog} when one is given.
     */
    public TransitionResult detect(MarketSnapshot current, MarketSnapshot previous, RegimeTransitionLog transitionLog) {
        RegimeType currentRegime = classifier.classify(current);
        if (previous == null) {
            return TransitionResult.initial(currentRegime);
        }

        RegimeType previousRegime = classifier.classify(previous);
        boolean transitionDetected = currentRegime != previousRegime;

        RuleAdjustment adjustment = baseAdjustment(current, previous);
        EmergencyProtocol emergency = emergencyProtocol(current, previous);
        if (emergency != null) {
            adjustment = new RuleAdjustment(
                    emergency.stopMultiplier(),
                    emergency.profitMultiplier(),
                    emergency.urgencyFactor(),
                    emergency.reason()
            );
        }

        TransitionResult result = new TransitionResult(
                transitionDetected,
                previousRegime,
                currentRegime,
                adjustment,
                emergency
        );
        if (transitionDetected || emergency != null) {
            record(result, current, transitionLog);
        }
        return result;
    }

    public RegimeConfig applyTo(RegimeConfig config, RuleAdjustment adjustment) {
        if (adjustment == null) {
            return config;
        }
        return adjustment.applyTo(config);
    }

    RuleAdjustment baseAdjustment(MarketSnapshot current, MarketSnapshot previous) {
        RuleAdjustment adjustment = RuleAdjustment.NEUTRAL;

        double vixChange = current.vix() - previous.vix();
        if (Math.abs(vixChange) > VIX_MAJOR_CHANGE) {
            if (vixChange > 0) {
                adjustment = adjustment.scale(
                        1.2 + vixChange / 50.0,
                        1.1 + vixChange / 100.0,
                        "VIX spike +" + format(vixChange, 1)
                );
            } else {
                adjustment = adjustment.scale(
                        0.9 + vixChange / 100.0,
                        0.95 + vixChange / 200.0,
                        "VIX decline " + format(vixChange, 1)
                );
            }
        }

        if (current.hasBreadth() && previous.hasBreadth()) {
            double breadthChange = current.t2108() - previous.t2108();
            if (breadthChange < BREADTH_COLLAPSE) {
                adjustment = adjustment
                        .scale(0.7, 0.8, "Breadth collapse " + format(breadthChange, 1))
                        .withMinimumUrgency(2.0);
            } else if (breadthChange > BREADTH_SURGE) {
                adjustment = adjustment.scale(1.0, 1.3, "Breadth surge +" + format(breadthChange, 1));
            }
        }

        if (current.hasMomentum() && previous.hasMomentum() && previous.momentumRatio() != 0.0) {
            double momentumChange = current.momentumRatio() / previous.momentumRatio();
            if (momentumChange < MOMENTUM_COLLAPSE_RATIO) {
                adjustment = adjustment
                        .scale(0.8, 1.0, "Momentum collapse " + format(momentumChange, 2) + "x")
                        .withMinimumUrgency(1.5);
            } else if (momentumChange > MOMENTUM_SURGE_RATIO) {
                adjustment = adjustment.scale(1.0, 1.2, "Momentum surge " + format(momentumChange, 2) + "x");
            }
        }
        return adjustment;
    }

    EmergencyProtocol emergencyProtocol(MarketSnapshot current, MarketSnapshot previous) {
        if (current.hasBreadth() && previous.hasBreadth()
                && current.t2108() - previous.t2108() < EMERGENCY_BREADTH_DROP) {
            return EmergencyProtocol.BREADTH_COLLAPSE;
        }
        if (current.vix() > EMERGENCY_VIX_LEVEL && current.vix() - previous.vix() > EMERGENCY_VIX_JUMP) {
            return EmergencyProtocol.VOLATILITY_EXPLOSION;
        }
        if (current.hasMomentum() && previous.hasMomentum()
                && current.momentumRatio() < EMERGENCY_MOMENTUM_FLOOR
                && previous.momentumRatio() > EMERGENCY_MOMENTUM_PRIOR) {
            return EmergencyProtocol.MOMENTUM_COLLAPSE;
        }
        return null;
    }

    private void record(TransitionResult result, MarketSnapshot current, RegimeTransitionLog transitionLog) {
        RuleAdjustment adjustment = result.adjustment();
        log.debug(
                "event=regime_transition day={} from={} to={} vix={} stopMult={} profitMult={} urgency={} emergency={} reason={}",
                current.day(),
                result.previousRegime().code(),
                result.currentRegime().code(),
                current.vix(),
                format(adjustment.stopMultiplier(), 3),
                format(adjustment.profitMultiplier(), 3),
                format(adjustment.urgencyFactor(), 2),
                result.emergencyTriggered() ? result.emergency().name() : "none",
                adjustment.reason()
        );
        if (transitionLog == null) {
            return;
        }
        transitionLog.append(new TransitionLogEntry(
                clock.instant(),
                current.day(),
                result.previousRegime(),
                result.currentRegime(),
                current.vix(),
                current.t2108(),
                current.momentumRatio(),
                adjustment.stopMultiplier(),
                adjustment.profitMultiplier(),
                adjustment.urgencyFactor(),
                adjustment.reason()
        ));
    }

    private static String format(double value, int digits) {
        return String.format(Locale.US, "%." + digits + "f", value);
    }
}
