package com.processlens.core.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, time-indexed multivariable table.
 *
 * <p>
 * Every series shares one strictly increasing time index. Missing values are
 * stored as {@link Double#NaN}, never as zero. Column order is the order in
 * which series were added (source-load order after alignment), and is
 * preserved by every derived view.
 * </p>
 *
 * <h3>Snapshots</h3>
 * <p>
 * Instances are never mutated after construction: filtering, selection and
 * resampling return new instances. An analysis can therefore read a dataset
 * while a new one is being ingested elsewhere.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(List.of(), new LinkedHashMap<>(), Map.of());

    private final List<LocalDateTime> index;
    private final Map<String, double[]> columns;
    private final Map<String, SeriesInfo> info;

    /**
     * @param index   strictly increasing timestamps
     * @param columns series name to values; every array must have the same
     *                length as {@code index}. Arrays are copied.
     * @param info    metadata per series; series without an entry get a
     *                default one
     * @throws IllegalArgumentException if lengths differ or the index is not
     *                                  strictly increasing
     */
    public Dataset(List<LocalDateTime> index,
            Map<String, double[]> columns,
            Map<String, SeriesInfo> info) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(info, "info must not be null");

        for (int i = 1; i < index.size(); i++) {
            if (!index.get(i).isAfter(index.get(i - 1))) {
                throw new IllegalArgumentException(
                        "Time index must be strictly increasing at position " + i
                                + ": " + index.get(i - 1) + " >= " + index.get(i));
            }
        }

        Map<String, double[]> copy = new LinkedHashMap<>();
        Map<String, SeriesInfo> infoCopy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] values = Objects.requireNonNull(e.getValue(), "values for " + e.getKey());
            if (values.length != index.size()) {
                throw new IllegalArgumentException("Series '" + e.getKey() + "' has "
                        + values.length + " values but the index has " + index.size());
            }
            copy.put(e.getKey(), values.clone());
            SeriesInfo meta = info.get(e.getKey());
            infoCopy.put(e.getKey(), meta != null ? meta : new SeriesInfo(e.getKey(), e.getKey(), null, null));
        }

        this.index = List.copyOf(index);
        this.columns = copy;
        this.info = Collections.unmodifiableMap(infoCopy);
    }

    public static Dataset empty() {
        return EMPTY;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public List<LocalDateTime> getIndex() {
        return index;
    }

    public int rowCount() {
        return index.size();
    }

    public int seriesCount() {
        return columns.size();
    }

    /**
     * @return {@code true} if the dataset has no rows or no series
     */
    public boolean isEmpty() {
        return index.isEmpty() || columns.isEmpty();
    }

    /**
     * @return series names in column order
     */
    public List<String> getSeriesNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean contains(String name) {
        return columns.containsKey(name);
    }

    /**
     * @param name series name
     * @return a copy of the series' values ({@code NaN} = missing)
     * @throws IllegalArgumentException if the series does not exist
     */
    public double[] getValues(String name) {
        return require(name).clone();
    }

    public double valueAt(String name, int row) {
        return require(name)[row];
    }

    public SeriesInfo getInfo(String name) {
        require(name);
        return info.get(name);
    }

    public Map<String, SeriesInfo> getInfo() {
        return info;
    }

    public String getShortName(String name) {
        return getInfo(name).getShortName();
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * Keep only rows whose timestamp lies in {@code window} (inclusive).
     *
     * @param window time window; must not be {@code null}
     * @return filtered dataset (possibly empty)
     */
    public Dataset slice(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            if (window.contains(index.get(i))) {
                rows.add(i);
            }
        }
        if (rows.size() == index.size()) {
            return this;
        }
        return keepRows(rows);
    }

    /**
     * Keep only the named series, in the given order.
     *
     * @param names series names; all must exist
     * @return dataset restricted to {@code names}
     * @throws IllegalArgumentException if a name is unknown
     */
    public Dataset select(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        Map<String, double[]> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, require(name));
        }
        return new Dataset(index, selected, info);
    }

    /**
     * Remove rows in which every series is missing.
     *
     * @return dataset without all-missing rows
     */
    public Dataset dropEmptyRows() {
        List<Integer> rows = new ArrayList<>();
        for (int i = 0; i < index.size(); i++) {
            for (double[] values : columns.values()) {
                if (!Double.isNaN(values[i])) {
                    rows.add(i);
                    break;
                }
            }
        }
        if (rows.size() == index.size()) {
            return this;
        }
        return keepRows(rows);
    }

    private Dataset keepRows(List<Integer> rows) {
        List<LocalDateTime> newIndex = new ArrayList<>(rows.size());
        for (int row : rows) {
            newIndex.add(index.get(row));
        }
        Map<String, double[]> newColumns = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] src = e.getValue();
            double[] dst = new double[rows.size()];
            for (int i = 0; i < dst.length; i++) {
                dst[i] = src[rows.get(i)];
            }
            newColumns.put(e.getKey(), dst);
        }
        return new Dataset(newIndex, newColumns, info);
    }

    private double[] require(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown series: '" + name + "'");
        }
        return values;
    }

    @Override
    public String toString() {
        return "Dataset{rows=" + index.size() + ", series=" + columns.keySet() + '}';
    }
}
