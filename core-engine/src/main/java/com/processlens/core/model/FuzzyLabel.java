package com.processlens.core.model;

import java.util.Locale;

/**
 * Linguistic label assigned to a value by quantile fuzzification.
 *
 * @since 1.0.0
 */
public enum FuzzyLabel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return lowercase label as printed in rules ({@code low}, {@code medium},
     *         {@code high})
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label();
    }
}
