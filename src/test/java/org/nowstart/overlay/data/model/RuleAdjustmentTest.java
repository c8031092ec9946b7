package org.nowstart.overlay.data.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.nowstart.overlay.data.type.RegimeType;

class RuleAdjustmentTest {

    @Test
    void scale_multipliesFactorsAndKeepsMaxUrgency() {
        RuleAdjustment combined = RuleAdjustment.NEUTRAL
                .scale(1.2, 1.1, "VIX spike")
                .withMinimumUrgency(1.5)
                .scale(0.7, 0.8, "Breadth collapse")
                .withMinimumUrgency(2.0)
                .withMinimumUrgency(1.2);

        assertThat(combined.stopMultiplier()).isCloseTo(0.84, within(1e-9));
        assertThat(combined.profitMultiplier()).isCloseTo(0.88, within(1e-9));
        assertThat(combined.urgencyFactor()).isEqualTo(2.0);
        assertThat(combined.reason()).isEqualTo("VIX spike; Breadth collapse");
    }

    @Test
    void isTrivial_onlyForNeutral() {
        assertThat(RuleAdjustment.NEUTRAL.isTrivial()).isTrue();
        assertThat(RuleAdjustment.NEUTRAL.scale(1.0, 1.3, "Breadth surge").isTrivial()).isFalse();
    }

    @Test
    void applyTo_scalesRulesAndShortensHoldOnUrgency() {
        RegimeConfig bull = RegimeRuleBook.defaults().get(RegimeType.BULL_NORMAL);
        RuleAdjustment adjustment = new RuleAdjustment(0.5, 0.6, 3.0, "EMERGENCY");

        RegimeConfig adjusted = adjustment.applyTo(bull);

        assertThat(adjusted.stopLossPct()).isCloseTo(-4.0, within(1e-9));
        assertThat(adjusted.trStopMultiplier()).isCloseTo(0.9, within(1e-9));
        assertThat(adjusted.profitLevelPct(0)).isCloseTo(7.2, within(1e-9));
        assertThat(adjusted.trProfitMultiplier(1)).isCloseTo(2.1, within(1e-9));
        assertThat(adjusted.positionScalingPct()).isEqualTo(bull.positionScalingPct());
        assertThat(adjusted.maxHoldDays()).isEqualTo(1);
    }

    @Test
    void adjustHoldDays_ignoresUrgencyAtOrBelowOne() {
        assertThat(new RuleAdjustment(1.5, 1.4, 0.7, "explosion").adjustHoldDays(4)).isEqualTo(4);
        assertThat(new RuleAdjustment(1.0, 1.0, 1.5, "collapse").adjustHoldDays(4)).isEqualTo(2);
        assertThat(new RuleAdjustment(1.0, 1.0, 2.0, "collapse").adjustHoldDays(1)).isEqualTo(1);
    }
}
