package org.nowstart.overlay.data.property;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backtest and grid-search settings. Grid axes use the {@code start:end:step} range form.
 */
@ConfigurationProperties(prefix = "overlay.backtest")
public record BacktestProperties(
        Integer baselineHoldDays,
        Integer topK,
        Integer gridParallelism,
        Integer gridProgressLogSeconds,
        Long maxGridCombinations,
        String gridLowVolUpperRange,
        String gridBullNormalUpperRange,
        String gridHighVolUpperRange,
        String gridStopScalarRange,
        String gridProfitScalarRange
) {
    private static final int DEFAULT_GRID_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());
    private static final String DEFAULT_LOW_VOL_UPPER_RANGE = "12:18:3";
    private static final String DEFAULT_BULL_NORMAL_UPPER_RANGE = "25:35:5";
    private static final String DEFAULT_HIGH_VOL_UPPER_RANGE = "45:55:5";
    private static final String DEFAULT_STOP_SCALAR_RANGE = "0.8:1.2:0.2";
    private static final String DEFAULT_PROFIT_SCALAR_RANGE = "0.8:1.2:0.2";

    public BacktestProperties {
        baselineHoldDays = baselineHoldDays != null ? baselineHoldDays : 2;
        topK = topK != null ? topK : 10;
        gridParallelism = gridParallelism != null ? gridParallelism : DEFAULT_GRID_PARALLELISM;
        gridProgressLogSeconds = gridProgressLogSeconds != null ? gridProgressLogSeconds : 5;
        maxGridCombinations = maxGridCombinations != null ? maxGridCombinations : 10_000L;
        gridLowVolUpperRange = normalizeSpec(gridLowVolUpperRange, DEFAULT_LOW_VOL_UPPER_RANGE);
        gridBullNormalUpperRange = normalizeSpec(gridBullNormalUpperRange, DEFAULT_BULL_NORMAL_UPPER_RANGE);
        gridHighVolUpperRange = normalizeSpec(gridHighVolUpperRange, DEFAULT_HIGH_VOL_UPPER_RANGE);
        gridStopScalarRange = normalizeSpec(gridStopScalarRange, DEFAULT_STOP_SCALAR_RANGE);
        gridProfitScalarRange = normalizeSpec(gridProfitScalarRange, DEFAULT_PROFIT_SCALAR_RANGE);

        if (baselineHoldDays <= 0) {
            throw new IllegalArgumentException("baseline-hold-days must be > 0");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("top-k must be > 0");
        }
        if (gridParallelism <= 0) {
            throw new IllegalArgumentException("grid-parallelism must be > 0");
        }
        if (gridProgressLogSeconds <= 0) {
            throw new IllegalArgumentException("grid-progress-log-seconds must be > 0");
        }
        if (maxGridCombinations <= 0) {
            throw new IllegalArgumentException("max-grid-combinations must be > 0");
        }
    }

    public static BacktestProperties defaults() {
        return new BacktestProperties(null, null, null, null, null, null, null, null, null, null);
    }

    public List<Double> resolveLowVolUpperValues() {
        return parsePositiveRange(gridLowVolUpperRange, "grid-low-vol-upper-range");
    }

    public List<Double> resolveBullNormalUpperValues() {
        return parsePositiveRange(gridBullNormalUpperRange, "grid-bull-normal-upper-range");
    }

    public List<Double> resolveHighVolUpperValues() {
        return parsePositiveRange(gridHighVolUpperRange, "grid-high-vol-upper-range");
    }

    public List<Double> resolveStopScalarValues() {
        return parsePositiveRange(gridStopScalarRange, "grid-stop-scalar-range");
    }

    public List<Double> resolveProfitScalarValues() {
        return parsePositiveRange(gridProfitScalarRange, "grid-profit-scalar-range");
    }

    /**
     * Ascending band triples of the grid. Non-ascending combinations are skipped.
     */
    public List<List<Double>> resolveVixBandTriples() {
        List<List<Double>> out = new ArrayList<>();
        for (double low : resolveLowVolUpperValues()) {
            for (double bull : resolveBullNormalUpperValues()) {
                for (double high : resolveHighVolUpperValues()) {
                    if (low < bull && bull < high) {
                        out.add(List.of(low, bull, high));
                    }
                }
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("grid VIX band ranges produce no ascending triple");
        }
        return List.copyOf(out);
    }

    public long combinationCount() {
        long total = 1L;
        total = multiply(total, resolveVixBandTriples().size());
        total = multiply(total, resolveStopScalarValues().size());
        total = multiply(total, resolveProfitScalarValues().size());
        return total;
    }

    private static long multiply(long left, int right) {
        if (right <= 0) {
            throw new IllegalArgumentException("grid axis must not be empty");
        }
        if (left > Long.MAX_VALUE / right) {
            throw new IllegalArgumentException("grid combination count overflow");
        }
        return left * right;
    }

    private static String normalizeSpec(String raw, String defaults) {
        if (raw == null || raw.isBlank()) {
            return defaults;
        }
        return raw.trim();
    }

    private static List<Double> parsePositiveRange(String spec, String fieldName) {
        List<Double> values = parseDoubleRange(spec);
        for (double value : values) {
            if (value <= 0.0) {
                throw new IllegalArgumentException(fieldName + " values must be > 0");
            }
        }
        return values;
    }

    private static List<Double> parseDoubleRange(String spec) {
        String[] parts = spec.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("range must be start:end:step, got: " + spec);
        }
        double start = Double.parseDouble(parts[0].trim());
        double end = Double.parseDouble(parts[1].trim());
        double step = Double.parseDouble(parts[2].trim());
        if (step <= 0) {
            throw new IllegalArgumentException("range step must be > 0, got: " + spec);
        }
        if (end < start) {
            throw new IllegalArgumentException("range end must be >= start, got: " + spec);
        }

        List<Double> out = new ArrayList<>();
        for (int i = 0; ; i++) {
            double value = start + i * step;
            if (value > end + 1e-9) {
                break;
            }
            out.add(value);
        }
        return List.copyOf(out);
    }
}
