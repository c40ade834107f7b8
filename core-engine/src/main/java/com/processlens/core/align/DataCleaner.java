package com.processlens.core.align;

import com.processlens.core.model.Dataset;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared cleaning convention for correlation, causality, step identification
 * and rule mining: linear interpolation, then removal of rows that still
 * contain a missing value.
 *
 * @since 1.0.0
 */
public final class DataCleaner {

    private DataCleaner() {
        // static helpers only
    }

    /**
     * Interpolate every series, then drop incomplete rows.
     *
     * @param dataset input; never modified
     * @return dataset in which no value is missing
     */
    public static Dataset clean(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Map<String, double[]> filled = new LinkedHashMap<>();
        for (String name : dataset.getSeriesNames()) {
            filled.put(name, interpolate(dataset.getValues(name)));
        }

        List<Integer> keep = new ArrayList<>();
        for (int row = 0; row < dataset.rowCount(); row++) {
            boolean complete = true;
            for (double[] values : filled.values()) {
                if (Double.isNaN(values[row])) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                keep.add(row);
            }
        }

        List<LocalDateTime> index = new ArrayList<>(keep.size());
        for (int row : keep) {
            index.add(dataset.getIndex().get(row));
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : filled.entrySet()) {
            double[] out = new double[keep.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = e.getValue()[keep.get(i)];
            }
            columns.put(e.getKey(), out);
        }
        return new Dataset(index, columns, dataset.getInfo());
    }

    /**
     * Linear interpolation by position. Interior gaps are interpolated,
     * trailing gaps repeat the last valid value, leading gaps stay
     * {@code NaN}.
     *
     * @param values input values; not modified
     * @return interpolated copy
     */
    public static double[] interpolate(double[] values) {
        double[] out = values.clone();
        int previous = -1;
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double step = (out[i] - out[previous]) / (i - previous);
                for (int j = previous + 1; j < i; j++) {
                    out[j] = out[previous] + step * (j - previous);
                }
            }
            previous = i;
        }
        if (previous >= 0) {
            for (int j = previous + 1; j < out.length; j++) {
                out[j] = out[previous];
            }
        }
        return out;
    }
}
