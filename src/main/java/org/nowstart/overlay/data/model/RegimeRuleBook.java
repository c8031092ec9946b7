package org.nowstart.overlay.data.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.overlay.data.type.RegimeType;

/**
 * Validated rule bundles keyed by regime. Built once at startup; every regime must be present.
 */
public final class RegimeRuleBook {

    private final Map<RegimeType, RegimeConfig> configs;

    public RegimeRuleBook(Map<RegimeType, RegimeConfig> configs) {
        if (configs == null) {
            throw new IllegalArgumentException("regime configs are required");
        }
        EnumMap<RegimeType, RegimeConfig> copy = new EnumMap<>(RegimeType.class);
        for (RegimeType regime : RegimeType.values()) {
            RegimeConfig config = configs.get(regime);
            if (config == null) {
                throw new IllegalStateException("Missing rule bundle for regime=" + regime.code());
            }
            validateBaseBundle(regime, config);
            copy.put(regime, config);
        }
        this.configs = Collections.unmodifiableMap(copy);
    }

    public static RegimeRuleBook defaults() {
        return new RegimeRuleBook(defaultConfigs());
    }

    public static Map<RegimeType, RegimeConfig> defaultConfigs() {
        EnumMap<RegimeType, RegimeConfig> defaults = new EnumMap<>(RegimeType.class);
        defaults.put(RegimeType.CRISIS_OPPORTUNITY, new RegimeConfig(
                -15.0,
                List.of(20.0, 35.0, 50.0),
                List.of(25.0, 50.0, 100.0),
                2.5,
                List.of(3.0, 5.0, 7.0),
                4,
                "Crisis: wide stops with aggressive profit-taking"
        ));
        defaults.put(RegimeType.HIGH_VOL_STRESS, new RegimeConfig(
                -12.0,
                List.of(15.0, 28.0, 45.0),
                List.of(25.0, 50.0, 100.0),
                2.0,
                List.of(2.5, 4.0, 6.0),
                3,
                "High volatility: balanced stops and targets"
        ));
        defaults.put(RegimeType.BULL_NORMAL, new RegimeConfig(
                -8.0,
                List.of(12.0, 25.0, 40.0),
                List.of(25.0, 50.0, 100.0),
                1.8,
                List.of(2.0, 3.5, 5.5),
                3,
                "Bull: standard defensive stops, moderate targets"
        ));
        defaults.put(RegimeType.LOW_VOL_COMPLACENCY, new RegimeConfig(
                -5.0,
                List.of(8.0, 15.0, 25.0),
                List.of(30.0, 60.0, 100.0),
                1.2,
                List.of(1.8, 3.0, 4.5),
                2,
                "Low volatility: tight stops, early profit-taking"
        ));
        return defaults;
    }

    public RegimeConfig get(RegimeType regime) {
        if (regime == null) {
            throw new IllegalArgumentException("regime is required");
        }
        return configs.get(regime);
    }

    public Map<RegimeType, RegimeConfig> asMap() {
        return configs;
    }

    /**
     * Returns a copy with every stop rule multiplied by {@code stopScalar} and every profit rule by
     * {@code profitScalar}. Scaling and hold days are untouched.
     */
    public RegimeRuleBook scaled(double stopScalar, double profitScalar) {
        if (!Double.isFinite(stopScalar) || stopScalar <= 0.0 || !Double.isFinite(profitScalar) || profitScalar <= 0.0) {
            throw new IllegalArgumentException("rule scalars must be finite and > 0");
        }
        EnumMap<RegimeType, RegimeConfig> scaled = new EnumMap<>(RegimeType.class);
        for (Map.Entry<RegimeType, RegimeConfig> entry : configs.entrySet()) {
            RegimeConfig config = entry.getValue();
            scaled.put(entry.getKey(), new RegimeConfig(
                    config.stopLossPct() * stopScalar,
                    config.profitLevelsPct().stream().map(level -> level * profitScalar).toList(),
                    config.positionScalingPct(),
                    config.trStopMultiplier() * stopScalar,
                    config.trProfitMultipliers().stream().map(mult -> mult * profitScalar).toList(),
                    config.maxHoldDays(),
                    config.description()
            ));
        }
        return new RegimeRuleBook(scaled);
    }

    private static void validateBaseBundle(RegimeType regime, RegimeConfig config) {
        if (config.stopLossPct() >= 0.0) {
            throw new IllegalStateException("stopLossPct must be negative for regime=" + regime.code());
        }
        if (config.trStopMultiplier() <= 0.0) {
            throw new IllegalStateException("trStopMultiplier must be > 0 for regime=" + regime.code());
        }
        for (int i = 0; i < RegimeConfig.LEVELS; i++) {
            if (config.profitLevelPct(i) <= 0.0) {
                throw new IllegalStateException("profitLevelsPct must be > 0 for regime=" + regime.code());
            }
            if (config.trProfitMultiplier(i) <= 0.0) {
                throw new IllegalStateException("trProfitMultipliers must be > 0 for regime=" + regime.code());
            }
        }
    }
}
