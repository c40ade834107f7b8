package com.processlens.core.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw tabular content of one source file: a header and string cells, the
 * first column being the time column.
 *
 * @since 1.0.0
 */
public final class SourceTable {

    private final String sourceId;
    private final String origin;
    private final List<String> header;
    private final List<List<String>> rows;

    /**
     * @param sourceId prefix used for this source's series names
     * @param origin   where the table came from (file path), for messages
     * @param header   column names, time column first
     * @param rows     data rows; each may be shorter than the header
     */
    public SourceTable(String sourceId, String origin, List<String> header, List<List<String>> rows) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
        this.header = List.copyOf(Objects.requireNonNull(header, "header must not be null"));
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getOrigin() {
        return origin;
    }

    public List<String> getHeader() {
        return header;
    }

    public String getTimeColumn() {
        return header.isEmpty() ? null : header.get(0);
    }

    public List<List<String>> getRows() {
        return rows;
    }

    /**
     * @return {@code true} if there is no header or no data row
     */
    public boolean isEmpty() {
        return header.isEmpty() || rows.isEmpty();
    }

    /**
     * @param row    row number
     * @param column column number (0 = time)
     * @return the cell, or {@code null} if the row is shorter
     */
    public String cell(int row, int column) {
        List<String> r = rows.get(row);
        return column < r.size() ? r.get(column) : null;
    }

    @Override
    public String toString() {
        return "SourceTable{" + sourceId + ", columns=" + header.size() + ", rows=" + rows.size() + '}';
    }
}
