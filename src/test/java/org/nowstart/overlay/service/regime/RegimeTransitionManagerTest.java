package org.nowstart.overlay.service.regime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.model.RuleAdjustment;
import org.nowstart.overlay.data.model.TransitionLogEntry;
import org.nowstart.overlay.data.model.TransitionResult;
import org.nowstart.overlay.data.type.EmergencyProtocol;
import org.nowstart.overlay.data.type.RegimeType;

class RegimeTransitionManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T21:00:00Z");

    private final RegimeTransitionManager manager = new RegimeTransitionManager(
            new RegimeClassifier(),
            Clock.fixed(NOW, ZoneOffset.UTC)
    );

    @Test
    void detect_withoutPreviousSnapshotReturnsNeutral() {
        TransitionResult result = manager.detect(MarketSnapshot.of(18.0), null);

        assertThat(result.transitionDetected()).isFalse();
        assertThat(result.previousRegime()).isNull();
        assertThat(result.currentRegime()).isEqualTo(RegimeType.BULL_NORMAL);
        assertThat(result.adjustment()).isEqualTo(RuleAdjustment.NEUTRAL);
    }

    @Test
    void detect_vixSpikeWidensStopsAndTargets() {
        TransitionResult result = manager.detect(MarketSnapshot.of(38.0), MarketSnapshot.of(18.0));

        assertThat(result.transitionDetected()).isTrue();
        assertThat(result.previousRegime()).isEqualTo(RegimeType.BULL_NORMAL);
        assertThat(result.currentRegime()).isEqualTo(RegimeType.HIGH_VOL_STRESS);
        assertThat(result.adjustment().stopMultiplier()).isCloseTo(1.6, within(1e-9));
        assertThat(result.adjustment().profitMultiplier()).isCloseTo(1.3, within(1e-9));
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(1.0);
        assertThat(result.adjustment().reason()).contains("VIX spike +20.0");
        assertThat(result.emergencyTriggered()).isFalse();
    }

    @Test
    void detect_vixDeclineTightensStops() {
        TransitionResult result = manager.detect(MarketSnapshot.of(20.0), MarketSnapshot.of(40.0));

        assertThat(result.adjustment().stopMultiplier()).isCloseTo(0.7, within(1e-9));
        assertThat(result.adjustment().profitMultiplier()).isCloseTo(0.85, within(1e-9));
        assertThat(result.adjustment().reason()).contains("VIX decline -20.0");
    }

    @Test
    void detect_rawDeltasAdjustWithoutRegimeChange() {
        TransitionResult result = manager.detect(
                MarketSnapshot.of(20.0, 35.0, 1.0),
                MarketSnapshot.of(20.0, 62.0, 1.0)
        );

        assertThat(result.transitionDetected()).isFalse();
        assertThat(result.adjustment().stopMultiplier()).isCloseTo(0.7, within(1e-9));
        assertThat(result.adjustment().profitMultiplier()).isCloseTo(0.8, within(1e-9));
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(2.0);
        assertThat(result.adjustment().reason()).contains("Breadth collapse");
    }

    @Test
    void detect_composesBreadthSurgeAndMomentumCollapse() {
        TransitionResult result = manager.detect(
                MarketSnapshot.of(20.0, 50.0, 0.8),
                MarketSnapshot.of(20.0, 25.0, 2.0)
        );

        assertThat(result.adjustment().stopMultiplier()).isCloseTo(0.8, within(1e-9));
        assertThat(result.adjustment().profitMultiplier()).isCloseTo(1.3, within(1e-9));
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(1.5);
        assertThat(result.adjustment().reason()).contains("Breadth surge").contains("Momentum collapse");
    }

    @Test
    void detect_momentumSurgeExtendsTargets() {
        TransitionResult result = manager.detect(
                MarketSnapshot.of(20.0, 40.0, 2.5),
                MarketSnapshot.of(20.0, 40.0, 1.0)
        );

        assertThat(result.adjustment().stopMultiplier()).isEqualTo(1.0);
        assertThat(result.adjustment().profitMultiplier()).isCloseTo(1.2, within(1e-9));
    }

    @Test
    void detect_breadthCollapseEmergencyReplacesBaseAdjustment() {
        TransitionResult result = manager.detect(
                MarketSnapshot.of(40.0, 20.0, 1.0),
                MarketSnapshot.of(20.0, 55.0, 1.0)
        );

        assertThat(result.emergency()).isEqualTo(EmergencyProtocol.BREADTH_COLLAPSE);
        assertThat(result.adjustment().stopMultiplier()).isEqualTo(0.6);
        assertThat(result.adjustment().profitMultiplier()).isEqualTo(0.7);
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(2.0);
        assertThat(result.adjustment().reason()).isEqualTo("EMERGENCY: Breadth collapse protocol activated");
    }

    @Test
    void detect_volatilityExplosionEmergency() {
        TransitionResult result = manager.detect(MarketSnapshot.of(65.0), MarketSnapshot.of(40.0));

        assertThat(result.emergency()).isEqualTo(EmergencyProtocol.VOLATILITY_EXPLOSION);
        assertThat(result.adjustment().stopMultiplier()).isEqualTo(1.5);
        assertThat(result.adjustment().profitMultiplier()).isEqualTo(1.4);
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(0.7);
    }

    @Test
    void detect_momentumCollapseEmergency() {
        TransitionResult result = manager.detect(
                MarketSnapshot.of(20.0, 40.0, 0.05),
                MarketSnapshot.of(20.0, 40.0, 1.5)
        );

        assertThat(result.emergency()).isEqualTo(EmergencyProtocol.MOMENTUM_COLLAPSE);
        assertThat(result.adjustment().stopMultiplier()).isEqualTo(0.5);
        assertThat(result.adjustment().urgencyFactor()).isEqualTo(3.0);
    }

    @Test
    void detect_appendsTransitionsToLog() {
        RegimeTransitionLog transitionLog = new RegimeTransitionLog();

        manager.detect(MarketSnapshot.of(38.0).withDay(3), MarketSnapshot.of(18.0), transitionLog);
        manager.detect(MarketSnapshot.of(19.0), MarketSnapshot.of(18.0), transitionLog);

        assertThat(transitionLog.size()).isEqualTo(1);
        TransitionLogEntry entry = transitionLog.entries().get(0);
        assertThat(entry.recordedAt()).isEqualTo(NOW);
        assertThat(entry.day()).isEqualTo(3);
        assertThat(entry.previousRegime()).isEqualTo(RegimeType.BULL_NORMAL);
        assertThat(entry.currentRegime()).isEqualTo(RegimeType.HIGH_VOL_STRESS);
        assertThat(entry.stopMultiplier()).isCloseTo(1.6, within(1e-9));
    }

    @Test
    void applyTo_scalesConfigAndKeepsItWithoutAdjustment() {
        RegimeConfig bull = RegimeRuleBook.defaults().get(RegimeType.BULL_NORMAL);
        TransitionResult result = manager.detect(MarketSnapshot.of(38.0), MarketSnapshot.of(18.0));

        RegimeConfig adjusted = manager.applyTo(bull, result.adjustment());

        assertThat(adjusted.stopLossPct()).isCloseTo(-12.8, within(1e-9));
        assertThat(adjusted.profitLevelPct(0)).isCloseTo(15.6, within(1e-9));
        assertThat(manager.applyTo(bull, null)).isSameAs(bull);
    }
}
