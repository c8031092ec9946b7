package org.nowstart.overlay.data.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.overlay.data.type.RegimeType;

class RegimeRuleBookTest {

    @Test
    void defaults_coverEveryRegime() {
        RegimeRuleBook ruleBook = RegimeRuleBook.defaults();

        assertThat(ruleBook.asMap()).containsOnlyKeys(RegimeType.values());
        assertThat(ruleBook.get(RegimeType.BULL_NORMAL).stopLossPct()).isEqualTo(-8.0);
        assertThat(ruleBook.get(RegimeType.LOW_VOL_COMPLACENCY).positionScalingPct()).containsExactly(30.0, 60.0, 100.0);
        assertThat(ruleBook.get(RegimeType.CRISIS_OPPORTUNITY).maxHoldDays()).isEqualTo(4);
    }

    @Test
    void constructor_rejectsMissingRegime() {
        Map<RegimeType, RegimeConfig> configs = new EnumMap<>(RegimeRuleBook.defaultConfigs());
        configs.remove(RegimeType.HIGH_VOL_STRESS);

        assertThatThrownBy(() -> new RegimeRuleBook(configs))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("high_vol_stress");
    }

    @Test
    void constructor_rejectsNonNegativeStop() {
        Map<RegimeType, RegimeConfig> configs = new EnumMap<>(RegimeRuleBook.defaultConfigs());
        configs.put(RegimeType.BULL_NORMAL, new RegimeConfig(
                5.0,
                List.of(12.0, 25.0, 40.0),
                List.of(25.0, 50.0, 100.0),
                1.8,
                List.of(2.0, 3.5, 5.5),
                3,
                "broken"
        ));

        assertThatThrownBy(() -> new RegimeRuleBook(configs))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stopLossPct");
    }

    @Test
    void scaled_multipliesStopAndProfitRulesOnly() {
        RegimeRuleBook scaled = RegimeRuleBook.defaults().scaled(1.2, 0.8);

        RegimeConfig bull = scaled.get(RegimeType.BULL_NORMAL);
        assertThat(bull.stopLossPct()).isCloseTo(-9.6, within(1e-9));
        assertThat(bull.trStopMultiplier()).isCloseTo(2.16, within(1e-9));
        assertThat(bull.profitLevelPct(0)).isCloseTo(9.6, within(1e-9));
        assertThat(bull.trProfitMultiplier(2)).isCloseTo(4.4, within(1e-9));
        assertThat(bull.positionScalingPct()).containsExactly(25.0, 50.0, 100.0);
        assertThat(bull.maxHoldDays()).isEqualTo(3);
    }

    @Test
    void scaled_rejectsNonPositiveScalar() {
        assertThatThrownBy(() -> RegimeRuleBook.defaults().scaled(0.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
