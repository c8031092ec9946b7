package org.nowstart.overlay.service.rule;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of the most recent True Range observations of one symbol.
 */
public class TrueRangeHistory {

    public static final int DEFAULT_WINDOW = 5;

    private final int window;
    private final Deque<Double> values = new ArrayDeque<>();

    public TrueRangeHistory() {
        this(DEFAULT_WINDOW);
    }

    public TrueRangeHistory(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.window = window;
    }

    /**
     * {@code max(high - low, |high - prevClose|, |low - prevClose|)}; falls back to the day's range
     * when there is no previous close.
     */
    public static double trueRange(double high, double low, Double previousClose) {
        double range = high - low;
        if (previousClose == null) {
            return range;
        }
        return Math.max(range, Math.max(Math.abs(high - previousClose), Math.abs(low - previousClose)));
    }

    public void record(double trueRange) {
        values.addLast(trueRange);
        while (values.size() > window) {
            values.removeFirst();
        }
    }

    public int size() {
        return values.size();
    }

    public double mean() {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Current True Range over the rolling mean. 1.0 when the window holds at most one value or its
     * mean is zero.
     */
    public double volatilityFactor(double currentTrueRange) {
        double mean = mean();
        if (values.size() <= 1 || mean <= 0.0) {
            return 1.0;
        }
        return currentTrueRange / mean;
    }
}
