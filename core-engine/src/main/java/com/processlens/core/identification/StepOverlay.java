package com.processlens.core.identification;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Plot-ready data for a successful identification: the original series, the
 * fitted curve over the step window and a vertical marker at the step start.
 *
 * @since 1.0.0
 */
public final class StepOverlay {

    private final String seriesName;
    private final List<LocalDateTime> times;
    private final double[] values;
    private final List<LocalDateTime> fittedTimes;
    private final double[] fittedValues;
    private final LocalDateTime marker;

    public StepOverlay(String seriesName, List<LocalDateTime> times, double[] values,
            List<LocalDateTime> fittedTimes, double[] fittedValues, LocalDateTime marker) {
        this.seriesName = Objects.requireNonNull(seriesName, "seriesName must not be null");
        this.times = List.copyOf(times);
        this.values = values.clone();
        this.fittedTimes = List.copyOf(fittedTimes);
        this.fittedValues = fittedValues.clone();
        this.marker = Objects.requireNonNull(marker, "marker must not be null");
        if (this.times.size() != this.values.length || this.fittedTimes.size() != this.fittedValues.length) {
            throw new IllegalArgumentException("Overlay times and values differ in length for " + seriesName);
        }
    }

    public String getSeriesName() {
        return seriesName;
    }

    public List<LocalDateTime> getTimes() {
        return times;
    }

    public double[] getValues() {
        return values.clone();
    }

    public List<LocalDateTime> getFittedTimes() {
        return fittedTimes;
    }

    public double[] getFittedValues() {
        return fittedValues.clone();
    }

    /** Step start, drawn as a vertical line. */
    public LocalDateTime getMarker() {
        return marker;
    }
}
