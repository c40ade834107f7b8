package com.processlens.core.model;

/**
 * Advisory PID settings derived from a {@link FittedStepModel}.
 *
 * <p>
 * These values come from a step-response heuristic and are never checked
 * against stability criteria.
 * </p>
 *
 * @since 1.0.0
 */
public final class TuningRecommendation {

    private final double deadTime;
    private final double proportionalGain;
    private final double integralTime;
    private final double derivativeTime;

    public TuningRecommendation(double deadTime, double proportionalGain,
            double integralTime, double derivativeTime) {
        this.deadTime = deadTime;
        this.proportionalGain = proportionalGain;
        this.integralTime = integralTime;
        this.derivativeTime = derivativeTime;
    }

    /** Dead-time estimate L in seconds. */
    public double getDeadTime() {
        return deadTime;
    }

    /** Kp. */
    public double getProportionalGain() {
        return proportionalGain;
    }

    /** Ti in seconds. */
    public double getIntegralTime() {
        return integralTime;
    }

    /** Td in seconds. */
    public double getDerivativeTime() {
        return derivativeTime;
    }

    @Override
    public String toString() {
        return "TuningRecommendation{L=" + deadTime + ", Kp=" + proportionalGain
                + ", Ti=" + integralTime + ", Td=" + derivativeTime + '}';
    }
}
