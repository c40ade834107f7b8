package com.processlens.core.stats;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.SeriesStatistics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics per series over the analysis window.
 *
 * <p>
 * Computed on the raw windowed values, missing entries excluded. The standard
 * deviation is the sample one ({@code n − 1}); skewness and kurtosis are the
 * bias-corrected sample estimates (excess kurtosis). Quartiles interpolate
 * linearly between order statistics. The missing rate is the fraction of
 * window rows in which the series is missing.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStatisticsCalculator {

    private SeriesStatisticsCalculator() {
        // utility class — not instantiable
    }

    /**
     * @param windowed dataset already restricted to the selection and window
     * @return one entry per series, in dataset order
     */
    public static List<SeriesStatistics> describe(Dataset windowed) {
        Objects.requireNonNull(windowed, "dataset must not be null");
        List<SeriesStatistics> out = new ArrayList<>(windowed.seriesCount());
        for (String name : windowed.getSeriesNames()) {
            out.add(describe(name, windowed.getValues(name)));
        }
        return out;
    }

    /**
     * @param name   series name
     * @param values window values, {@code NaN} for missing
     * @return statistics; all fields {@code NaN} when no value is valid
     */
    public static SeriesStatistics describe(String name, double[] values) {
        double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        SeriesStatistics.Builder b = SeriesStatistics.builder(name)
                .count(valid.length)
                .missingRate(values.length == 0 ? Double.NaN
                        : (double) (values.length - valid.length) / values.length);
        if (valid.length == 0) {
            return b.build();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(valid);
        Percentile quartiles = new Percentile().withEstimationType(EstimationType.R_7);
        quartiles.setData(valid);

        return b.mean(stats.getMean())
                .std(valid.length < 2 ? Double.NaN : stats.getStandardDeviation())
                .min(stats.getMin())
                .p25(quartiles.evaluate(25))
                .median(quartiles.evaluate(50))
                .p75(quartiles.evaluate(75))
                .max(stats.getMax())
                .skewness(stats.getSkewness())
                .kurtosis(stats.getKurtosis())
                .build();
    }
}
