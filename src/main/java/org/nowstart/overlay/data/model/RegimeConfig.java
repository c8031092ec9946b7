package org.nowstart.overlay.data.model;

import java.util.List;

/**
 * Rule bundle of one regime. Percentages are expressed in percent (e.g. {@code -8.0}, {@code 12.0}).
 *
 * <p>Structural invariants are checked on construction. Sign rules (negative stop, positive multipliers)
 * only hold for the configured base bundles and are enforced by {@link RegimeRuleBook}, because
 * transition adjustments may legitimately push derived copies outside them.
 */
public record RegimeConfig(
        double stopLossPct,
        List<Double> profitLevelsPct,
        List<Double> positionScalingPct,
        double trStopMultiplier,
        List<Double> trProfitMultipliers,
        int maxHoldDays,
        String description
) {

    public static final int LEVELS = 3;

    public RegimeConfig {
        requireFinite("stopLossPct", stopLossPct);
        requireFinite("trStopMultiplier", trStopMultiplier);
        profitLevelsPct = copyLevels("profitLevelsPct", profitLevelsPct);
        positionScalingPct = copyLevels("positionScalingPct", positionScalingPct);
        trProfitMultipliers = copyLevels("trProfitMultipliers", trProfitMultipliers);
        validateScaling(positionScalingPct);
        validateAscending(profitLevelsPct);
        if (maxHoldDays < 1) {
            throw new IllegalArgumentException("maxHoldDays must be >= 1");
        }
        description = description == null ? "" : description;
    }

    public double profitLevelPct(int level) {
        return profitLevelsPct.get(level);
    }

    public double positionScaling(int level) {
        return positionScalingPct.get(level);
    }

    public double trProfitMultiplier(int level) {
        return trProfitMultipliers.get(level);
    }

    private static List<Double> copyLevels(String field, List<Double> values) {
        if (values == null || values.size() != LEVELS) {
            throw new IllegalArgumentException(field + " must contain exactly " + LEVELS + " values");
        }
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException(field + " values must be finite");
            }
        }
        return List.copyOf(values);
    }

    private static void validateScaling(List<Double> scaling) {
        double previous = 0.0;
        for (double value : scaling) {
            if (value <= previous) {
                throw new IllegalArgumentException("positionScalingPct must be strictly ascending and positive");
            }
            previous = value;
        }
        if (Double.compare(previous, 100.0) != 0) {
            throw new IllegalArgumentException("positionScalingPct must end at 100");
        }
    }

    private static void validateAscending(List<Double> levels) {
        for (int i = 1; i < levels.size(); i++) {
            if (levels.get(i) < levels.get(i - 1)) {
                throw new IllegalArgumentException("profitLevelsPct must be ascending");
            }
        }
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite");
        }
    }
}
