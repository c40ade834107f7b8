package com.processlens.core.align;

import com.processlens.core.model.SeriesInfo;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed source ready for alignment: a sorted, duplicate-free time index
 * and source-prefixed numeric columns.
 *
 * @since 1.0.0
 */
public final class SourceFrame {

    private final String sourceId;
    private final List<LocalDateTime> times;
    private final Map<String, double[]> columns;
    private final Map<String, SeriesInfo> info;

    /**
     * @param sourceId source identifier
     * @param times    strictly increasing timestamps
     * @param columns  prefixed series name to values, in header order
     * @param info     metadata per series
     */
    public SourceFrame(String sourceId, List<LocalDateTime> times,
            Map<String, double[]> columns, Map<String, SeriesInfo> info) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.times = List.copyOf(Objects.requireNonNull(times, "times must not be null"));
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(columns, "columns must not be null")));
        this.info = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(info, "info must not be null")));
        for (Map.Entry<String, double[]> e : this.columns.entrySet()) {
            if (e.getValue().length != this.times.size()) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' of source '"
                        + sourceId + "' does not match its time index");
            }
        }
    }

    public String getSourceId() {
        return sourceId;
    }

    public List<LocalDateTime> getTimes() {
        return times;
    }

    public Map<String, double[]> getColumns() {
        return columns;
    }

    public Map<String, SeriesInfo> getInfo() {
        return info;
    }

    @Override
    public String toString() {
        return "SourceFrame{" + sourceId + ", rows=" + times.size() + ", columns=" + columns.keySet() + '}';
    }
}
