package com.processlens.core.align;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates a dataset onto a fixed-period grid.
 *
 * <p>
 * Buckets are anchored at the first timestamp: bucket {@code k} covers
 * {@code [t0 + k·period, t0 + (k+1)·period)} and is labeled by its start.
 * Only buckets containing at least one input row are emitted, so no label
 * falls outside the input span. Rows whose every series aggregates to
 * {@code NaN} are dropped.
 * </p>
 *
 * @since 1.0.0
 */
public final class Resampler {

    private static final Logger LOG = LoggerFactory.getLogger(Resampler.class);

    private Resampler() {
        // utility class
    }

    /**
     * @param dataset    input; never modified
     * @param period     bucket width
     * @param aggregator per-bucket function
     * @return the resampled dataset
     */
    public static Dataset resample(Dataset dataset, ResamplePeriod period, Aggregator aggregator) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(aggregator, "aggregator must not be null");
        if (dataset.rowCount() == 0) {
            return dataset;
        }

        List<LocalDateTime> index = dataset.getIndex();
        LocalDateTime origin = index.get(0);
        long periodNanos = period.getDuration().toNanos();

        // bucket number → input rows, in time order
        List<Long> buckets = new ArrayList<>();
        List<List<Integer>> members = new ArrayList<>();
        for (int row = 0; row < index.size(); row++) {
            long bucket = Duration.between(origin, index.get(row)).toNanos() / periodNanos;
            if (buckets.isEmpty() || buckets.get(buckets.size() - 1) != bucket) {
                buckets.add(bucket);
                members.add(new ArrayList<>());
            }
            members.get(members.size() - 1).add(row);
        }

        List<LocalDateTime> newIndex = new ArrayList<>(buckets.size());
        for (long bucket : buckets) {
            newIndex.add(origin.plusNanos(bucket * periodNanos));
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String name : dataset.getSeriesNames()) {
            double[] values = dataset.getValues(name);
            double[] out = new double[buckets.size()];
            for (int b = 0; b < out.length; b++) {
                List<Integer> rows = members.get(b);
                double[] bucketValues = new double[rows.size()];
                for (int i = 0; i < bucketValues.length; i++) {
                    bucketValues[i] = values[rows.get(i)];
                }
                out[b] = aggregator.apply(bucketValues);
            }
            columns.put(name, out);
        }

        Dataset result = new Dataset(newIndex, columns, dataset.getInfo()).dropEmptyRows();
        LOG.debug("Resampled {} row(s) into {} bucket(s) of {} using {}",
                dataset.rowCount(), result.rowCount(), period, aggregator.label());
        return result;
    }

    /**
     * Resample from textual settings, reporting invalid settings instead of
     * throwing.
     *
     * @param dataset        input
     * @param periodText     period string such as {@code 5T}
     * @param aggregatorName aggregator name
     * @return the resampled dataset, or a {@link ErrorKind#CONFIGURATION}
     *         failure; the caller keeps the input data on failure
     */
    public static Outcome<Dataset> tryResample(Dataset dataset, String periodText, String aggregatorName) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        if (periodText == null || aggregatorName == null) {
            return Outcome.failure(ErrorKind.CONFIGURATION, "resample",
                    "resampling failed, keeping raw data: period and aggregator are required");
        }
        ResamplePeriod period;
        Aggregator aggregator;
        try {
            period = ResamplePeriod.parse(periodText);
            aggregator = Aggregator.fromName(aggregatorName);
        } catch (IllegalArgumentException e) {
            LOG.warn("Resampling skipped: {}", e.getMessage());
            return Outcome.failure(ErrorKind.CONFIGURATION, "resample",
                    "resampling failed, keeping raw data: " + e.getMessage());
        }
        return Outcome.success(resample(dataset, period, aggregator));
    }
}
