package com.processlens.core.ingest;

import java.util.Objects;

/**
 * Derives display names and units from full series names.
 *
 * <p>
 * Pure functions: the result depends only on the argument, so there is no
 * shared cache. {@link com.processlens.core.model.SeriesInfo} stores the
 * result once per series at ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShortNames {

    /** Names longer than this are truncated. */
    public static final int MAX_LENGTH = 15;

    private ShortNames() {
        // utility class — not instantiable
    }

    /**
     * {@code "Flow (m3/h)"} becomes {@code "Flow"}, {@code "(TIC-101)"} becomes
     * {@code "TIC-101"}, and anything else is cut to {@value #MAX_LENGTH}
     * characters with {@code ...} appended.
     *
     * @param fullName full series name; must not be {@code null}
     * @return short display name
     */
    public static String shortName(String fullName) {
        Objects.requireNonNull(fullName, "fullName must not be null");
        if (fullName.contains("(") && fullName.contains(")")) {
            String before = fullName.substring(0, fullName.indexOf('(')).trim();
            if (!before.isEmpty()) {
                return before;
            }
            return bracketContent(fullName);
        }
        return fullName.length() > MAX_LENGTH
                ? fullName.substring(0, MAX_LENGTH) + "..."
                : fullName;
    }

    /**
     * @param fullName full series name
     * @return text inside the first pair of brackets, or {@code null} if there
     *         is none
     */
    public static String units(String fullName) {
        if (fullName == null || !fullName.contains("(") || !fullName.contains(")")) {
            return null;
        }
        String content = bracketContent(fullName);
        return content.isEmpty() ? null : content;
    }

    private static String bracketContent(String fullName) {
        String afterOpen = fullName.substring(fullName.indexOf('(') + 1);
        int close = afterOpen.indexOf(')');
        return (close >= 0 ? afterOpen.substring(0, close) : afterOpen).trim();
    }
}
