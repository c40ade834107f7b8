package com.processlens.core.detection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One-dimensional peak finder with distance and prominence constraints.
 *
 * <p>
 * Processing order:
 * </p>
 * <ol>
 * <li>Local maxima: a sample strictly greater than its left neighbour and
 * followed, after an optional flat run, by a strictly smaller sample. A flat
 * top is reported at its middle sample (the left one of the two middles for
 * even runs). The first and last samples are never peaks.</li>
 * <li>Distance: peaks are visited from highest to lowest; every peak closer
 * than {@code minDistance} samples to a kept, higher peak is discarded.</li>
 * <li>Prominence: the height of a peak above the higher of the two minima
 * found walking outward until a higher sample or the border is met. Peaks
 * below {@code minProminence} are discarded.</li>
 * </ol>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class PeakFinder {

    private final int minDistance;
    private final double minProminence;

    /**
     * @param minDistance   minimum index separation between peaks (>= 1)
     * @param minProminence minimum prominence a peak must reach
     */
    public PeakFinder(int minDistance, double minProminence) {
        if (minDistance < 1) {
            throw new IllegalArgumentException("minDistance must be >= 1, got: " + minDistance);
        }
        if (Double.isNaN(minProminence)) {
            throw new IllegalArgumentException("minProminence must not be NaN");
        }
        this.minDistance = minDistance;
        this.minProminence = minProminence;
    }

    /**
     * @param x signal
     * @return indices of accepted peaks, ascending
     */
    public int[] find(double[] x) {
        Objects.requireNonNull(x, "signal must not be null");
        int[] peaks = localMaxima(x);
        peaks = selectByDistance(x, peaks, minDistance);
        return Arrays.stream(peaks)
                .filter(p -> prominence(x, p) >= minProminence)
                .toArray();
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    static int[] localMaxima(double[] x) {
        List<Integer> peaks = new ArrayList<>();
        int last = x.length - 1;
        int i = 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    peaks.add((i + ahead - 1) / 2);
                    i = ahead;
                }
            }
            i++;
        }
        return peaks.stream().mapToInt(Integer::intValue).toArray();
    }

    static int[] selectByDistance(double[] x, int[] peaks, int distance) {
        if (peaks.length < 2) {
            return peaks;
        }
        boolean[] keep = new boolean[peaks.length];
        Arrays.fill(keep, true);

        // positions ordered by ascending height; ties keep index order
        Integer[] byHeight = new Integer[peaks.length];
        for (int i = 0; i < peaks.length; i++) {
            byHeight[i] = i;
        }
        Arrays.sort(byHeight, Comparator.comparingDouble(pos -> x[peaks[pos]]));

        for (int r = peaks.length - 1; r >= 0; r--) {
            int j = byHeight[r];
            if (!keep[j]) {
                continue;
            }
            for (int k = j - 1; k >= 0 && peaks[j] - peaks[k] < distance; k--) {
                keep[k] = false;
            }
            for (int k = j + 1; k < peaks.length && peaks[k] - peaks[j] < distance; k++) {
                keep[k] = false;
            }
        }

        int[] kept = new int[peaks.length];
        int n = 0;
        for (int i = 0; i < peaks.length; i++) {
            if (keep[i]) {
                kept[n++] = peaks[i];
            }
        }
        return Arrays.copyOf(kept, n);
    }

    static double prominence(double[] x, int peak) {
        double height = x[peak];

        double leftMin = height;
        for (int i = peak; i >= 0 && x[i] <= height; i--) {
            leftMin = Math.min(leftMin, x[i]);
        }
        double rightMin = height;
        for (int i = peak; i < x.length && x[i] <= height; i++) {
            rightMin = Math.min(rightMin, x[i]);
        }
        return height - Math.max(leftMin, rightMin);
    }

    public int getMinDistance() {
        return minDistance;
    }

    public double getMinProminence() {
        return minProminence;
    }
}
