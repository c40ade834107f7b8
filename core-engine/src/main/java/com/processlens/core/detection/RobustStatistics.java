package com.processlens.core.detection;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Objects;

/**
 * Outlier-resistant location and scale estimates used for adaptive
 * thresholds.
 *
 * @since 1.0.0
 */
public final class RobustStatistics {

    private RobustStatistics() {
        // utility class — not instantiable
    }

    /**
     * @param values input; empty input yields {@code NaN}
     * @return the median; the mean of the two middle values for even lengths
     */
    public static double median(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        return new Median().evaluate(values);
    }

    /**
     * Centered rolling median. Windows are truncated at the edges, so every
     * position has a value as long as the input is not empty.
     *
     * @param values input values
     * @param window window width, at least 1
     * @return smoothed values, same length as the input
     */
    public static double[] rollingMedian(double[] values, int window) {
        Objects.requireNonNull(values, "values must not be null");
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got: " + window);
        }
        int before = window / 2;
        int after = window - 1 - before;
        Median median = new Median();
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(values.length - 1, i + after);
            out[i] = median.evaluate(values, from, to - from + 1);
        }
        return out;
    }

    /**
     * Median absolute deviation about the median (unscaled).
     *
     * @param values input values
     * @return MAD, or {@code NaN} for empty input
     */
    public static double medianAbsoluteDeviation(double[] values) {
        double center = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    /**
     * @param values input values
     * @return {@code values[i+1] - values[i]}, one shorter than the input
     */
    public static double[] differences(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i + 1] - values[i];
        }
        return out;
    }
}
