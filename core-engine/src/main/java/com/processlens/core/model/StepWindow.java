package com.processlens.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Contiguous index range of a series flagged as containing a step transition.
 *
 * @since 1.0.0
 */
public final class StepWindow {

    private final String seriesName;
    private final int startIndex;
    private final int endIndex;
    private final int peakIndex;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;

    /**
     * @param seriesName series the window belongs to
     * @param startIndex first index (inclusive)
     * @param endIndex   last index (inclusive)
     * @param peakIndex  index of the difference peak that produced the window
     * @param startTime  timestamp at {@code startIndex}
     * @param endTime    timestamp at {@code endIndex}
     * @throws IllegalArgumentException if the index range is empty or negative
     */
    public StepWindow(String seriesName, int startIndex, int endIndex, int peakIndex,
            LocalDateTime startTime, LocalDateTime endTime) {
        this.seriesName = Objects.requireNonNull(seriesName, "seriesName must not be null");
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException(
                    "Invalid step window [" + startIndex + ", " + endIndex + "] for " + seriesName);
        }
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.peakIndex = peakIndex;
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(endTime, "endTime must not be null");
    }

    public String getSeriesName() {
        return seriesName;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public int getPeakIndex() {
        return peakIndex;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    /**
     * @return number of samples in the window
     */
    public int length() {
        return endIndex - startIndex + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StepWindow that))
            return false;
        return startIndex == that.startIndex
                && endIndex == that.endIndex
                && peakIndex == that.peakIndex
                && seriesName.equals(that.seriesName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesName, startIndex, endIndex, peakIndex);
    }

    @Override
    public String toString() {
        return "StepWindow{" + seriesName + " [" + startIndex + ", " + endIndex + "] "
                + startTime + " -> " + endTime + '}';
    }
}
