package com.processlens.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Inclusive time range used to filter a dataset before any analysis.
 *
 * <p>
 * Either bound may be {@code null}, meaning unbounded on that side.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeWindow {

    /** Window that accepts every timestamp. */
    public static final TimeWindow ALL = new TimeWindow(null, null);

    private final LocalDateTime start;
    private final LocalDateTime end;

    /**
     * @param start inclusive lower bound, or {@code null}
     * @param end   inclusive upper bound, or {@code null}
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public TimeWindow(LocalDateTime start, LocalDateTime end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException(
                    "Window start " + start + " is after window end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static TimeWindow of(LocalDateTime start, LocalDateTime end) {
        return new TimeWindow(start, end);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    /**
     * @param time timestamp to test
     * @return {@code true} if {@code time} lies within both bounds (inclusive)
     */
    public boolean contains(LocalDateTime time) {
        if (start != null && time.isBefore(start)) {
            return false;
        }
        return end == null || !time.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + (start == null ? "-inf" : start) + ", " + (end == null ? "+inf" : end) + "]";
    }
}
