package com.processlens.core.model;

import java.util.Objects;

/**
 * Metadata for one series, built once at ingestion and passed by value.
 *
 * @since 1.0.0
 */
public final class SeriesInfo {

    private final String name;
    private final String shortName;
    private final String source;
    private final String units;

    /**
     * @param name      globally unique, source-prefixed series name
     * @param shortName display name
     * @param source    source identifier the series was loaded from; may be
     *                  {@code null} for derived series
     * @param units     unit text taken from the column header; may be
     *                  {@code null}
     */
    public SeriesInfo(String name, String shortName, String source, String units) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.shortName = Objects.requireNonNull(shortName, "shortName must not be null");
        this.source = source;
        this.units = units;
    }

    public String getName() {
        return name;
    }

    public String getShortName() {
        return shortName;
    }

    public String getSource() {
        return source;
    }

    public String getUnits() {
        return units;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesInfo that))
            return false;
        return name.equals(that.name)
                && shortName.equals(that.shortName)
                && Objects.equals(source, that.source)
                && Objects.equals(units, that.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shortName, source, units);
    }

    @Override
    public String toString() {
        return "SeriesInfo{" +
                "name='" + name + '\'' +
                ", shortName='" + shortName + '\'' +
                ", source='" + source + '\'' +
                ", units='" + units + '\'' +
                '}';
    }
}
