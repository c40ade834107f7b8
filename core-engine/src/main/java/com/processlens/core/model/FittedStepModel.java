package com.processlens.core.model;

/**
 * Parameters of a fitted first-order-lag curve
 * {@code y(t) = K·(1 − e^(−t/τ)) + y0} plus its goodness of fit.
 *
 * <p>
 * {@code rSquared} may be negative (fit worse than the mean predictor) and is
 * {@link Double#NaN} when the segment is constant, so the coefficient is
 * undefined.
 * </p>
 *
 * @since 1.0.0
 */
public final class FittedStepModel {

    private final double gain;
    private final double timeConstant;
    private final double initialValue;
    private final double rSquared;

    public FittedStepModel(double gain, double timeConstant, double initialValue, double rSquared) {
        this.gain = gain;
        this.timeConstant = timeConstant;
        this.initialValue = initialValue;
        this.rSquared = rSquared;
    }

    /** Process gain K. */
    public double getGain() {
        return gain;
    }

    /** Time constant τ in seconds. */
    public double getTimeConstant() {
        return timeConstant;
    }

    /** Initial level y0. */
    public double getInitialValue() {
        return initialValue;
    }

    public double getRSquared() {
        return rSquared;
    }

    public boolean hasRSquared() {
        return !Double.isNaN(rSquared);
    }

    /**
     * Evaluate the fitted curve.
     *
     * @param seconds time since the start of the step window
     * @return model value
     */
    public double valueAt(double seconds) {
        return gain * (1 - Math.exp(-seconds / timeConstant)) + initialValue;
    }

    @Override
    public String toString() {
        return "FittedStepModel{K=" + gain + ", tau=" + timeConstant + ", y0=" + initialValue
                + ", R2=" + rSquared + '}';
    }
}
