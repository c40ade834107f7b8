package com.processlens.core.ingest;

import com.processlens.core.model.AnalysisError;
import com.processlens.core.model.Dataset;

import java.util.List;
import java.util.Objects;

/**
 * Dataset snapshot produced by an ingestion run, with per-file errors and
 * informational notes (dropped columns, discarded duplicates).
 *
 * @since 1.0.0
 */
public final class IngestResult {

    private final Dataset dataset;
    private final List<String> loadedSources;
    private final List<AnalysisError> errors;
    private final List<String> notes;

    public IngestResult(Dataset dataset, List<String> loadedSources,
            List<AnalysisError> errors, List<String> notes) {
        this.dataset = Objects.requireNonNull(dataset, "dataset must not be null");
        this.loadedSources = List.copyOf(loadedSources);
        this.errors = List.copyOf(errors);
        this.notes = List.copyOf(notes);
    }

    public Dataset getDataset() {
        return dataset;
    }

    /**
     * @return origins of the sources that were merged
     */
    public List<String> getLoadedSources() {
        return loadedSources;
    }

    /**
     * @return one error per skipped file
     */
    public List<AnalysisError> getErrors() {
        return errors;
    }

    public List<String> getNotes() {
        return notes;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "IngestResult{" + dataset + ", loaded=" + loadedSources.size()
                + ", errors=" + errors.size() + '}';
    }
}
