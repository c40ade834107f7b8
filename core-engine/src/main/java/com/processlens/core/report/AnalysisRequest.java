package com.processlens.core.report;

import com.processlens.core.model.TimeWindow;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What to analyze: the ordered series selection, the time window, optional
 * resampling and the analyses to run.
 *
 * <p>
 * Selection order matters: fuzzy mining treats the last series as the output
 * and causality pairs follow it. Unset resampling and analysis fields fall
 * back to the engine configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisRequest {

    private final List<String> selection;
    private final TimeWindow window;
    private final String resamplePeriod;
    private final String aggregator;
    private final Set<AnalysisKind> analyses;
    private final Integer fuzzyTopK;

    private AnalysisRequest(Builder b) {
        this.selection = List.copyOf(b.selection);
        this.window = b.window;
        this.resamplePeriod = b.resamplePeriod;
        this.aggregator = b.aggregator;
        this.analyses = b.analyses == null ? null : EnumSet.copyOf(b.analyses);
        this.fuzzyTopK = b.fuzzyTopK;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getSelection() {
        return selection;
    }

    public TimeWindow getWindow() {
        return window;
    }

    /** Period string, or {@code null} for the configured default. */
    public String getResamplePeriod() {
        return resamplePeriod;
    }

    /** Aggregator name, or {@code null} for the configured default. */
    public String getAggregator() {
        return aggregator;
    }

    /** Requested analyses, or {@code null} for the configured default. */
    public Set<AnalysisKind> getAnalyses() {
        return analyses == null ? null : EnumSet.copyOf(analyses);
    }

    public Integer getFuzzyTopK() {
        return fuzzyTopK;
    }

    @Override
    public String toString() {
        return "AnalysisRequest{selection=" + selection + ", window=" + window
                + ", resample=" + resamplePeriod + "/" + aggregator + ", analyses=" + analyses + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private final List<String> selection = new ArrayList<>();
        private TimeWindow window = TimeWindow.ALL;
        private String resamplePeriod;
        private String aggregator;
        private Set<AnalysisKind> analyses;
        private Integer fuzzyTopK;

        private Builder() {
        }

        public Builder select(List<String> names) {
            Objects.requireNonNull(names, "names must not be null");
            selection.addAll(names);
            return this;
        }

        public Builder select(String... names) {
            return select(List.of(names));
        }

        public Builder window(TimeWindow window) {
            this.window = Objects.requireNonNull(window, "window must not be null");
            return this;
        }

        public Builder resample(String period, String aggregator) {
            this.resamplePeriod = period;
            this.aggregator = aggregator;
            return this;
        }

        public Builder analyses(Set<AnalysisKind> kinds) {
            Objects.requireNonNull(kinds, "kinds must not be null");
            this.analyses = kinds.isEmpty() ? EnumSet.noneOf(AnalysisKind.class) : EnumSet.copyOf(kinds);
            return this;
        }

        public Builder analyses(AnalysisKind first, AnalysisKind... rest) {
            return analyses(EnumSet.of(first, rest));
        }

        public Builder fuzzyTopK(int topK) {
            if (topK < 1) {
                throw new IllegalArgumentException("fuzzyTopK must be >= 1, got: " + topK);
            }
            this.fuzzyTopK = topK;
            return this;
        }

        public AnalysisRequest build() {
            for (String name : selection) {
                Objects.requireNonNull(name, "selected series name must not be null");
            }
            if (selection.stream().distinct().count() != selection.size()) {
                throw new IllegalArgumentException("Selection contains duplicates: " + selection);
            }
            return new AnalysisRequest(this);
        }
    }
}
