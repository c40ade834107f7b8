package com.processlens.core.detection;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.model.StepWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds candidate step-change windows in a single series.
 *
 * <p>
 * The first differences are smoothed with a centered rolling median of width
 * {@value #SMOOTHING_WINDOW}, which suppresses single-sample spikes. The
 * adaptive threshold is {@code max(floor, multiplier × MAD)} of the smoothed
 * differences; it is used as the minimum prominence for peaks of their
 * absolute value. Each accepted peak {@code p} yields the window
 * {@code [max(0, p − halfWidth), min(len − 1, p + halfWidth)]}.
 * </p>
 *
 * <p>
 * Series shorter than the configured detection minimum produce no windows.
 * The detector is stateless and may be shared across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class StepDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StepDetector.class);

    static final int SMOOTHING_WINDOW = 3;

    private final int minLength;
    private final int peakDistance;
    private final int halfWidth;
    private final double madMultiplier;
    private final double thresholdFloor;

    /**
     * @param config analysis configuration; must not be {@code null}
     */
    public StepDetector(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.minLength = config.getStepDetectionMinLength();
        this.peakDistance = config.getPeakDistance();
        this.halfWidth = config.getStepHalfWidth();
        this.madMultiplier = config.getMadMultiplier();
        this.thresholdFloor = config.getThresholdFloor();
    }

    /**
     * @param seriesName name recorded in each window
     * @param times      timestamps, same length as {@code values}
     * @param values     series values without missing entries
     * @return every candidate window, in index order; empty if none
     */
    public List<StepWindow> detect(String seriesName, List<LocalDateTime> times, double[] values) {
        Objects.requireNonNull(seriesName, "seriesName must not be null");
        Objects.requireNonNull(times, "times must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (times.size() != values.length) {
            throw new IllegalArgumentException("times and values differ in length: "
                    + times.size() + " vs " + values.length);
        }
        if (values.length < minLength) {
            return List.of();
        }

        double[] smoothed = RobustStatistics.rollingMedian(
                RobustStatistics.differences(values), SMOOTHING_WINDOW);
        double threshold = threshold(smoothed);

        double[] magnitude = new double[smoothed.length];
        for (int i = 0; i < smoothed.length; i++) {
            magnitude[i] = Math.abs(smoothed[i]);
        }
        int[] peaks = new PeakFinder(peakDistance, threshold).find(magnitude);
        LOG.debug("Series '{}': threshold={}, peaks at {}", seriesName, threshold, peaks);

        List<StepWindow> windows = new ArrayList<>(peaks.length);
        int last = values.length - 1;
        for (int p : peaks) {
            int start = Math.max(0, p - halfWidth);
            int end = Math.min(last, p + halfWidth);
            windows.add(new StepWindow(seriesName, start, end, p, times.get(start), times.get(end)));
        }
        return windows;
    }

    /**
     * @param smoothedDifferences smoothed first differences
     * @return the adaptive prominence threshold
     */
    double threshold(double[] smoothedDifferences) {
        double mad = RobustStatistics.medianAbsoluteDeviation(smoothedDifferences);
        return Math.max(thresholdFloor, madMultiplier * mad);
    }
}
