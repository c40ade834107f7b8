package com.processlens.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.processlens.core.fuzzy.FuzzyRuleSet;
import com.processlens.core.identification.StepIdentificationResult;
import com.processlens.core.model.AnalysisError;
import com.processlens.core.model.CausalityResult;
import com.processlens.core.model.CorrelationMatrix;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.SeriesStatistics;
import com.processlens.core.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Results of one analysis request.
 *
 * <p>
 * Every requested analysis has its own {@link Outcome}; a failed analysis
 * does not affect the others. If preparation itself failed (unknown series,
 * empty window) {@link #getPreparationError()} is set and no analysis ran.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisReport {

    private final List<String> selection;
    private final TimeWindow window;
    private final AnalysisError preparationError;
    private final List<String> notes;
    private final Integer rowCount;
    private final Integer cleanedRowCount;
    private final Dataset table;
    private final Map<AnalysisKind, Outcome<?>> sections;

    private AnalysisReport(Builder b) {
        this.selection = List.copyOf(b.selection);
        this.window = b.window;
        this.preparationError = b.preparationError;
        this.notes = List.copyOf(b.notes);
        this.rowCount = b.prepared == null ? null : b.prepared.getTable().rowCount();
        this.cleanedRowCount = b.prepared == null ? null : b.prepared.getCleaned().rowCount();
        this.table = b.prepared == null ? null : b.prepared.getTable();
        this.sections = Collections.unmodifiableMap(new EnumMap<>(b.sections));
    }

    public static Builder builder(AnalysisRequest request) {
        return new Builder(request);
    }

    public List<String> getSelection() {
        return selection;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public AnalysisError getPreparationError() {
        return preparationError;
    }

    public List<String> getNotes() {
        return notes;
    }

    /** Rows in the windowed selection, or {@code null} if preparation failed. */
    public Integer getRowCount() {
        return rowCount;
    }

    public Integer getCleanedRowCount() {
        return cleanedRowCount;
    }

    /**
     * @return the windowed (and resampled) selection, for export; {@code null}
     *         if preparation failed
     */
    @JsonIgnore
    public Dataset getTable() {
        return table;
    }

    @JsonIgnore
    public Map<AnalysisKind, Outcome<?>> getSections() {
        return sections;
    }

    @JsonIgnore
    public boolean isPrepared() {
        return preparationError == null;
    }

    @SuppressWarnings("unchecked")
    public Outcome<List<SeriesStatistics>> getStatistics() {
        return (Outcome<List<SeriesStatistics>>) sections.get(AnalysisKind.STATISTICS);
    }

    @SuppressWarnings("unchecked")
    public Outcome<CorrelationMatrix> getCorrelation() {
        return (Outcome<CorrelationMatrix>) sections.get(AnalysisKind.CORRELATION);
    }

    @SuppressWarnings("unchecked")
    public Outcome<List<StepIdentificationResult>> getStepIdentification() {
        return (Outcome<List<StepIdentificationResult>>) sections.get(AnalysisKind.STEP_IDENTIFICATION);
    }

    @SuppressWarnings("unchecked")
    public Outcome<FuzzyRuleSet> getFuzzyRules() {
        return (Outcome<FuzzyRuleSet>) sections.get(AnalysisKind.FUZZY_RULES);
    }

    @SuppressWarnings("unchecked")
    public Outcome<List<CausalityResult>> getCausality() {
        return (Outcome<List<CausalityResult>>) sections.get(AnalysisKind.CAUSALITY);
    }

    /**
     * @return every failure in the report: preparation, whole analyses and
     *         individual items (series, pairs)
     */
    @JsonIgnore
    public List<AnalysisError> getErrors() {
        List<AnalysisError> errors = new ArrayList<>();
        if (preparationError != null) {
            errors.add(preparationError);
        }
        sections.values().stream()
                .filter(o -> !o.isSuccess())
                .map(Outcome::getError)
                .forEach(errors::add);
        return errors;
    }

    @Override
    public String toString() {
        return "AnalysisReport{selection=" + selection + ", window=" + window + ", rows=" + rowCount
                + ", sections=" + sections.keySet()
                + (preparationError != null ? ", error=" + preparationError.describe() : "") + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Collects sections as analyses finish. Not thread-safe: a single writer
     * assembles the report.
     */
    public static final class Builder {
        private final List<String> selection;
        private final TimeWindow window;
        private final List<String> notes = new ArrayList<>();
        private final Map<AnalysisKind, Outcome<?>> sections = new EnumMap<>(AnalysisKind.class);
        private AnalysisError preparationError;
        private PreparedSelection prepared;

        private Builder(AnalysisRequest request) {
            Objects.requireNonNull(request, "request must not be null");
            this.selection = request.getSelection();
            this.window = request.getWindow();
        }

        public Builder prepared(PreparedSelection prepared) {
            this.prepared = Objects.requireNonNull(prepared, "prepared must not be null");
            this.notes.addAll(prepared.getNotes());
            return this;
        }

        public Builder preparationError(AnalysisError error) {
            this.preparationError = Objects.requireNonNull(error, "error must not be null");
            return this;
        }

        public Builder section(AnalysisKind kind, Outcome<?> outcome) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(outcome, "outcome must not be null");
            if (sections.putIfAbsent(kind, outcome) != null) {
                throw new IllegalStateException("Section already recorded: " + kind);
            }
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }
}
