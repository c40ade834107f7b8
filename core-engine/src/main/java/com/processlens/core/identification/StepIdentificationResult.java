package com.processlens.core.identification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.processlens.core.model.FittedStepModel;
import com.processlens.core.model.StepWindow;
import com.processlens.core.model.TuningRecommendation;

import java.util.Objects;

/**
 * Outcome of step identification for one series.
 *
 * <p>
 * Which fields are set depends on the {@link StepIdentificationStatus}:
 * </p>
 * <ul>
 * <li>{@code TOO_SHORT}, {@code NO_STEP_FOUND} — message only (plus the
 * window when the window itself was too short)</li>
 * <li>{@code FIT_FAILED} — window, steady values and message</li>
 * <li>{@code FIT_SUCCEEDED} — window, steady values, model, tuning and
 * overlay</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepIdentificationResult {

    private final String seriesName;
    private final StepIdentificationStatus status;
    private final String message;
    private final StepWindow window;
    private final Double preStepMean;
    private final Double postStepMean;
    private final FittedStepModel model;
    private final TuningRecommendation tuning;
    private final StepOverlay overlay;

    private StepIdentificationResult(Builder builder) {
        this.seriesName = Objects.requireNonNull(builder.seriesName, "seriesName must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.message = builder.message;
        this.window = builder.window;
        this.preStepMean = builder.preStepMean;
        this.postStepMean = builder.postStepMean;
        this.model = builder.model;
        this.tuning = builder.tuning;
        this.overlay = builder.overlay;
    }

    public static StepIdentificationResult tooShort(String seriesName, String message) {
        return builder(seriesName, StepIdentificationStatus.TOO_SHORT).message(message).build();
    }

    public static StepIdentificationResult noStepFound(String seriesName) {
        return builder(seriesName, StepIdentificationStatus.NO_STEP_FOUND)
                .message("no clear step detected").build();
    }

    static Builder builder(String seriesName, StepIdentificationStatus status) {
        return new Builder(seriesName, status);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSeriesName() {
        return seriesName;
    }

    public StepIdentificationStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public StepWindow getWindow() {
        return window;
    }

    public Double getPreStepMean() {
        return preStepMean;
    }

    public Double getPostStepMean() {
        return postStepMean;
    }

    public FittedStepModel getModel() {
        return model;
    }

    public TuningRecommendation getTuning() {
        return tuning;
    }

    public StepOverlay getOverlay() {
        return overlay;
    }

    public boolean isSucceeded() {
        return status == StepIdentificationStatus.FIT_SUCCEEDED;
    }

    @Override
    public String toString() {
        return "StepIdentificationResult{series='" + seriesName + "', status=" + status
                + (message != null ? ", message='" + message + '\'' : "")
                + (model != null ? ", model=" + model : "") + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    static final class Builder {
        private final String seriesName;
        private final StepIdentificationStatus status;
        private String message;
        private StepWindow window;
        private Double preStepMean;
        private Double postStepMean;
        private FittedStepModel model;
        private TuningRecommendation tuning;
        private StepOverlay overlay;

        private Builder(String seriesName, StepIdentificationStatus status) {
            this.seriesName = seriesName;
            this.status = status;
        }

        Builder message(String v) {
            this.message = v;
            return this;
        }

        Builder window(StepWindow v) {
            this.window = v;
            return this;
        }

        Builder steadyValues(double pre, double post) {
            this.preStepMean = pre;
            this.postStepMean = post;
            return this;
        }

        Builder model(FittedStepModel v) {
            this.model = v;
            return this;
        }

        Builder tuning(TuningRecommendation v) {
            this.tuning = v;
            return this;
        }

        Builder overlay(StepOverlay v) {
            this.overlay = v;
            return this;
        }

        StepIdentificationResult build() {
            return new StepIdentificationResult(this);
        }
    }
}
