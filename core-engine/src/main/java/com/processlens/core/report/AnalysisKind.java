package com.processlens.core.report;

import java.util.Locale;
import java.util.Objects;

/**
 * Top-level analyses, in report order.
 *
 * @since 1.0.0
 */
public enum AnalysisKind {

    STATISTICS("statistics", "Descriptive statistics"),
    CORRELATION("correlation", "Pearson correlation matrix"),
    STEP_IDENTIFICATION("step-identification", "Step identification and PID suggestion"),
    FUZZY_RULES("fuzzy-rules", "Fuzzy rules (quantile method)"),
    CAUSALITY("causality", "Granger-style predictability (x -> y: past x helps predict y)");

    private final String configName;
    private final String title;

    AnalysisKind(String configName, String title) {
        this.configName = configName;
        this.title = title;
    }

    /**
     * @param name configuration name such as {@code fuzzy-rules}
     *             (case-insensitive)
     * @return matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AnalysisKind fromName(String name) {
        Objects.requireNonNull(name, "analysis name must not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AnalysisKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown analysis: '" + name + "'");
    }

    public String getConfigName() {
        return configName;
    }

    public String getTitle() {
        return title;
    }
}
