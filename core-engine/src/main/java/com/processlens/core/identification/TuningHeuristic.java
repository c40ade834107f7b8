package com.processlens.core.identification;

import com.processlens.core.model.FittedStepModel;
import com.processlens.core.model.TuningRecommendation;

import java.util.Objects;

/**
 * Ziegler-Nichols style step-response tuning rule.
 *
 * <pre>
 * L  = max(0, 0.1·τ)
 * Kp = 1.2·τ / (|K|·(L + ε))
 * Ti = 2·L
 * Td = 0.5·L
 * </pre>
 *
 * <p>
 * A gain below {@value #GAIN_FLOOR} in magnitude is replaced by the floor
 * before division. The values are advisory only: they are not checked
 * against any stability criterion.
 * </p>
 *
 * @since 1.0.0
 */
public final class TuningHeuristic {

    static final double DEAD_TIME_RATIO = 0.1;
    static final double GAIN_FLOOR = 1e-9;
    static final double DEAD_TIME_EPSILON = 1e-9;

    private TuningHeuristic() {
        // utility class — not instantiable
    }

    /**
     * @param model fitted step model
     * @return PID suggestion
     */
    public static TuningRecommendation recommend(FittedStepModel model) {
        Objects.requireNonNull(model, "model must not be null");
        return recommend(model.getGain(), model.getTimeConstant());
    }

    /**
     * @param gain         process gain K
     * @param timeConstant time constant τ in seconds
     * @return PID suggestion
     */
    public static TuningRecommendation recommend(double gain, double timeConstant) {
        double deadTime = Math.max(0.0, DEAD_TIME_RATIO * timeConstant);
        double k = Math.abs(gain) < GAIN_FLOOR ? GAIN_FLOOR : gain;
        double kp = 1.2 * timeConstant / (Math.abs(k) * (deadTime + DEAD_TIME_EPSILON));
        return new TuningRecommendation(deadTime, kp, 2 * deadTime, 0.5 * deadTime);
    }
}
