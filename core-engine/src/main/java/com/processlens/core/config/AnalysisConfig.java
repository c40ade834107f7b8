package com.processlens.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Tunables for the analytics engine, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * minStepSeriesLength: 30
 * peakDistance: 5
 * stepHalfWidth: 8
 * madMultiplier: 3.0
 * fuzzyTopK: 20
 * resamplePeriod: 5T
 * aggregator: mean
 * analyses: [statistics, correlation, step-identification, fuzzy-rules, causality]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    /** Names accepted in {@code analyses}. */
    public static final List<String> ANALYSIS_NAMES = List.of(
            "statistics", "correlation", "step-identification", "fuzzy-rules", "causality");

    // --- Step detection ---
    /** Series shorter than this are reported as too short for step identification. */
    private int minStepSeriesLength = 30;

    /** The detector itself returns nothing below this length. */
    private int stepDetectionMinLength = 10;

    /** Minimum index separation between accepted difference peaks. */
    private int peakDistance = 5;

    /** A step window spans {@code peak ± stepHalfWidth}. */
    private int stepHalfWidth = 8;

    /** Threshold = max(thresholdFloor, madMultiplier × MAD). */
    private double madMultiplier = 3.0;

    private double thresholdFloor = 1e-6;

    // --- First-order identification ---
    /** Windows with fewer samples are not fitted. */
    private int minFitSamples = 6;

    /** Samples averaged for the pre-/post-step steady values. */
    private int steadyStateSamples = 10;

    private int maxFitEvaluations = 10_000;

    // --- Fuzzy rules ---
    private int fuzzyTopK = 20;

    private double lowQuantile = 0.33;

    private double highQuantile = 0.66;

    // --- Causality ---
    private int maxCausalityLag = 10;

    /** maxlag = clamp(rows / causalityLagDivisor, 1, maxCausalityLag). */
    private int causalityLagDivisor = 5;

    // --- Resampling ---
    /** Period string such as {@code 5T}; {@code null} keeps raw data. */
    private String resamplePeriod;

    private String aggregator = "mean";

    // --- Analyses to run ---
    private List<String> analyses = new ArrayList<>(ANALYSIS_NAMES);

    /**
     * @return configuration with every default applied
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every value, collecting all problems.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minStepSeriesLength < 2) {
            errors.add("'minStepSeriesLength' must be >= 2");
        }
        if (stepDetectionMinLength < 2) {
            errors.add("'stepDetectionMinLength' must be >= 2");
        }
        if (peakDistance < 1) {
            errors.add("'peakDistance' must be >= 1");
        }
        if (stepHalfWidth < 1) {
            errors.add("'stepHalfWidth' must be >= 1");
        }
        if (madMultiplier <= 0) {
            errors.add("'madMultiplier' must be > 0");
        }
        if (thresholdFloor <= 0) {
            errors.add("'thresholdFloor' must be > 0");
        }
        if (minFitSamples < 3) {
            errors.add("'minFitSamples' must be >= 3 (three parameters are fitted)");
        }
        if (steadyStateSamples < 1) {
            errors.add("'steadyStateSamples' must be >= 1");
        }
        if (maxFitEvaluations < 1) {
            errors.add("'maxFitEvaluations' must be >= 1");
        }
        if (fuzzyTopK < 1) {
            errors.add("'fuzzyTopK' must be >= 1");
        }
        if (lowQuantile <= 0 || highQuantile >= 1 || lowQuantile >= highQuantile) {
            errors.add("quantiles must satisfy 0 < lowQuantile < highQuantile < 1, got: "
                    + lowQuantile + ", " + highQuantile);
        }
        if (maxCausalityLag < 1) {
            errors.add("'maxCausalityLag' must be >= 1");
        }
        if (causalityLagDivisor < 1) {
            errors.add("'causalityLagDivisor' must be >= 1");
        }
        if (aggregator == null || aggregator.isBlank()) {
            errors.add("'aggregator' is required");
        }
        for (String analysis : analyses) {
            if (analysis == null || !ANALYSIS_NAMES.contains(analysis.toLowerCase(Locale.ROOT))) {
                errors.add("Unknown analysis: '" + analysis + "'. Supported: "
                        + String.join(", ", ANALYSIS_NAMES));
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getMinStepSeriesLength() {
        return minStepSeriesLength;
    }

    public void setMinStepSeriesLength(int minStepSeriesLength) {
        this.minStepSeriesLength = minStepSeriesLength;
    }

    public int getStepDetectionMinLength() {
        return stepDetectionMinLength;
    }

    public void setStepDetectionMinLength(int stepDetectionMinLength) {
        this.stepDetectionMinLength = stepDetectionMinLength;
    }

    public int getPeakDistance() {
        return peakDistance;
    }

    public void setPeakDistance(int peakDistance) {
        this.peakDistance = peakDistance;
    }

    public int getStepHalfWidth() {
        return stepHalfWidth;
    }

    public void setStepHalfWidth(int stepHalfWidth) {
        this.stepHalfWidth = stepHalfWidth;
    }

    public double getMadMultiplier() {
        return madMultiplier;
    }

    public void setMadMultiplier(double madMultiplier) {
        this.madMultiplier = madMultiplier;
    }

    public double getThresholdFloor() {
        return thresholdFloor;
    }

    public void setThresholdFloor(double thresholdFloor) {
        this.thresholdFloor = thresholdFloor;
    }

    public int getMinFitSamples() {
        return minFitSamples;
    }

    public void setMinFitSamples(int minFitSamples) {
        this.minFitSamples = minFitSamples;
    }

    public int getSteadyStateSamples() {
        return steadyStateSamples;
    }

    public void setSteadyStateSamples(int steadyStateSamples) {
        this.steadyStateSamples = steadyStateSamples;
    }

    public int getMaxFitEvaluations() {
        return maxFitEvaluations;
    }

    public void setMaxFitEvaluations(int maxFitEvaluations) {
        this.maxFitEvaluations = maxFitEvaluations;
    }

    public int getFuzzyTopK() {
        return fuzzyTopK;
    }

    public void setFuzzyTopK(int fuzzyTopK) {
        this.fuzzyTopK = fuzzyTopK;
    }

    public double getLowQuantile() {
        return lowQuantile;
    }

    public void setLowQuantile(double lowQuantile) {
        this.lowQuantile = lowQuantile;
    }

    public double getHighQuantile() {
        return highQuantile;
    }

    public void setHighQuantile(double highQuantile) {
        this.highQuantile = highQuantile;
    }

    public int getMaxCausalityLag() {
        return maxCausalityLag;
    }

    public void setMaxCausalityLag(int maxCausalityLag) {
        this.maxCausalityLag = maxCausalityLag;
    }

    public int getCausalityLagDivisor() {
        return causalityLagDivisor;
    }

    public void setCausalityLagDivisor(int causalityLagDivisor) {
        this.causalityLagDivisor = causalityLagDivisor;
    }

    public String getResamplePeriod() {
        return resamplePeriod;
    }

    public void setResamplePeriod(String resamplePeriod) {
        this.resamplePeriod = resamplePeriod;
    }

    public String getAggregator() {
        return aggregator;
    }

    public void setAggregator(String aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * @return unmodifiable list of enabled analysis names
     */
    public List<String> getAnalyses() {
        return Collections.unmodifiableList(analyses);
    }

    public void setAnalyses(List<String> analyses) {
        this.analyses = analyses != null ? new ArrayList<>(analyses) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "minStepSeriesLength=" + minStepSeriesLength +
                ", peakDistance=" + peakDistance +
                ", stepHalfWidth=" + stepHalfWidth +
                ", madMultiplier=" + madMultiplier +
                ", minFitSamples=" + minFitSamples +
                ", fuzzyTopK=" + fuzzyTopK +
                ", quantiles=[" + lowQuantile + ", " + highQuantile + "]" +
                ", maxCausalityLag=" + maxCausalityLag +
                ", resamplePeriod='" + resamplePeriod + '\'' +
                ", aggregator='" + aggregator + '\'' +
                ", analyses=" + analyses +
                '}';
    }
}
