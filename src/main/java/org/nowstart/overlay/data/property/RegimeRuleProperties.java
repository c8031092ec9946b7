package org.nowstart.overlay.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Negative;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.type.RegimeType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Regime rule bundles under {@code overlay.regimes}. A missing bundle or a missing field falls back to
 * the built-in default of that regime.
 */
@Validated
@ConfigurationProperties(prefix = "overlay.regimes")
public record RegimeRuleProperties(
        @Valid RegimeRule crisisOpportunity,
        @Valid RegimeRule highVolStress,
        @Valid RegimeRule bullNormal,
        @Valid RegimeRule lowVolComplacency
) {

    public RegimeRuleBook toRuleBook() {
        Map<RegimeType, RegimeConfig> defaults = RegimeRuleBook.defaultConfigs();
        Map<RegimeType, RegimeConfig> configs = new EnumMap<>(RegimeType.class);
        configs.put(RegimeType.CRISIS_OPPORTUNITY, merge(crisisOpportunity, defaults.get(RegimeType.CRISIS_OPPORTUNITY)));
        configs.put(RegimeType.HIGH_VOL_STRESS, merge(highVolStress, defaults.get(RegimeType.HIGH_VOL_STRESS)));
        configs.put(RegimeType.BULL_NORMAL, merge(bullNormal, defaults.get(RegimeType.BULL_NORMAL)));
        configs.put(RegimeType.LOW_VOL_COMPLACENCY, merge(lowVolComplacency, defaults.get(RegimeType.LOW_VOL_COMPLACENCY)));
        return new RegimeRuleBook(configs);
    }

    private static RegimeConfig merge(RegimeRule rule, RegimeConfig fallback) {
        if (rule == null) {
            return fallback;
        }
        return new RegimeConfig(
                rule.stopLossPct() != null ? rule.stopLossPct() : fallback.stopLossPct(),
                rule.profitLevelsPct() != null ? rule.profitLevelsPct() : fallback.profitLevelsPct(),
                rule.positionScalingPct() != null ? rule.positionScalingPct() : fallback.positionScalingPct(),
                rule.trStopMultiplier() != null ? rule.trStopMultiplier() : fallback.trStopMultiplier(),
                rule.trProfitMultipliers() != null ? rule.trProfitMultipliers() : fallback.trProfitMultipliers(),
                rule.maxHoldDays() != null ? rule.maxHoldDays() : fallback.maxHoldDays(),
                rule.description() != null ? rule.description() : fallback.description()
        );
    }

    public record RegimeRule(
            // 손절 기준(%) - 음수
            @Negative Double stopLossPct,
            // 3단계 익절 목표(%)
            @Size(min = 3, max = 3) List<Double> profitLevelsPct,
            // 단계별 누적 청산 비율(%), 마지막 값은 100
            @Size(min = 3, max = 3) List<Double> positionScalingPct,
            // True Range 손절 배수
            @Positive Double trStopMultiplier,
            // 단계별 True Range 익절 배수
            @Size(min = 3, max = 3) List<Double> trProfitMultipliers,
            // 최대 보유 일수
            @Positive Integer maxHoldDays,
            String description
    ) {
    }
}
