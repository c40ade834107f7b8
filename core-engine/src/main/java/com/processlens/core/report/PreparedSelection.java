package com.processlens.core.report;

import com.processlens.core.align.DataCleaner;
import com.processlens.core.model.Dataset;

import java.util.List;
import java.util.Objects;

/**
 * Selected series restricted to the window and optionally resampled, plus
 * their cleaned form. Shared read-only by every analysis of one request.
 *
 * @since 1.0.0
 */
public final class PreparedSelection {

    private final Dataset table;
    private final Dataset cleaned;
    private final List<String> notes;

    /**
     * @param table windowed (and resampled) selection
     * @param notes preparation notes, e.g. a resampling fallback
     */
    public PreparedSelection(Dataset table, List<String> notes) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.cleaned = DataCleaner.clean(table);
        this.notes = List.copyOf(notes);
    }

    /** Raw windowed values, missing entries kept. */
    public Dataset getTable() {
        return table;
    }

    /** Interpolated values with incomplete rows removed. */
    public Dataset getCleaned() {
        return cleaned;
    }

    public List<String> getNotes() {
        return notes;
    }
}
