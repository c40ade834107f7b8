package com.processlens.core.model;

import java.util.Objects;

/**
 * Descriptive statistics for one series over the analysis window.
 *
 * <p>
 * All central-tendency and dispersion fields are {@link Double#NaN} when the
 * series has no valid sample.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStatistics {

    private final String seriesName;
    private final long count;
    private final double mean;
    private final double std;
    private final double min;
    private final double p25;
    private final double median;
    private final double p75;
    private final double max;
    private final double missingRate;
    private final double skewness;
    private final double kurtosis;

    private SeriesStatistics(Builder b) {
        this.seriesName = Objects.requireNonNull(b.seriesName, "seriesName must not be null");
        this.count = b.count;
        this.mean = b.mean;
        this.std = b.std;
        this.min = b.min;
        this.p25 = b.p25;
        this.median = b.median;
        this.p75 = b.p75;
        this.max = b.max;
        this.missingRate = b.missingRate;
        this.skewness = b.skewness;
        this.kurtosis = b.kurtosis;
    }

    public static Builder builder(String seriesName) {
        return new Builder(seriesName);
    }

    public String getSeriesName() {
        return seriesName;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMin() {
        return min;
    }

    public double getP25() {
        return p25;
    }

    public double getMedian() {
        return median;
    }

    public double getP75() {
        return p75;
    }

    public double getMax() {
        return max;
    }

    public double getMissingRate() {
        return missingRate;
    }

    public double getSkewness() {
        return skewness;
    }

    public double getKurtosis() {
        return kurtosis;
    }

    /**
     * Fluent builder; every statistic defaults to {@link Double#NaN}.
     */
    public static class Builder {
        private final String seriesName;
        private long count;
        private double mean = Double.NaN;
        private double std = Double.NaN;
        private double min = Double.NaN;
        private double p25 = Double.NaN;
        private double median = Double.NaN;
        private double p75 = Double.NaN;
        private double max = Double.NaN;
        private double missingRate = Double.NaN;
        private double skewness = Double.NaN;
        private double kurtosis = Double.NaN;

        private Builder(String seriesName) {
            this.seriesName = seriesName;
        }

        public Builder count(long v) {
            this.count = v;
            return this;
        }

        public Builder mean(double v) {
            this.mean = v;
            return this;
        }

        public Builder std(double v) {
            this.std = v;
            return this;
        }

        public Builder min(double v) {
            this.min = v;
            return this;
        }

        public Builder p25(double v) {
            this.p25 = v;
            return this;
        }

        public Builder median(double v) {
            this.median = v;
            return this;
        }

        public Builder p75(double v) {
            this.p75 = v;
            return this;
        }

        public Builder max(double v) {
            this.max = v;
            return this;
        }

        public Builder missingRate(double v) {
            this.missingRate = v;
            return this;
        }

        public Builder skewness(double v) {
            this.skewness = v;
            return this;
        }

        public Builder kurtosis(double v) {
            this.kurtosis = v;
            return this;
        }

        public SeriesStatistics build() {
            return new SeriesStatistics(this);
        }
    }

    @Override
    public String toString() {
        return "SeriesStatistics{" + seriesName + ", count=" + count + ", mean=" + mean
                + ", std=" + std + ", min=" + min + ", max=" + max
                + ", missingRate=" + missingRate + '}';
    }
}
