package com.processlens.core.align;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-bucket aggregation function. Every aggregator skips missing values and
 * returns {@code NaN} for a bucket without any valid value.
 *
 * @since 1.0.0
 */
public enum Aggregator {

    MEAN {
        @Override
        double combine(double[] valid) {
            double sum = 0;
            for (double v : valid) {
                sum += v;
            }
            return sum / valid.length;
        }
    },

    FIRST {
        @Override
        double combine(double[] valid) {
            return valid[0];
        }
    },

    MAX {
        @Override
        double combine(double[] valid) {
            return Arrays.stream(valid).max().orElse(Double.NaN);
        }
    },

    MIN {
        @Override
        double combine(double[] valid) {
            return Arrays.stream(valid).min().orElse(Double.NaN);
        }
    },

    MEDIAN {
        @Override
        double combine(double[] valid) {
            return new Median().evaluate(valid);
        }
    };

    /**
     * @param name aggregator name (case-insensitive)
     * @return the aggregator
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Aggregator fromName(String name) {
        Objects.requireNonNull(name, "aggregator name must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregator: '" + name
                    + "'. Supported: mean, first, max, min, median", e);
        }
    }

    /**
     * Aggregate values in bucket order, ignoring {@code NaN}.
     *
     * @param values bucket values (may contain {@code NaN})
     * @return aggregate, or {@code NaN} if no value is valid
     */
    public double apply(double[] values) {
        double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        return valid.length == 0 ? Double.NaN : combine(valid);
    }

    abstract double combine(double[] valid);

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
