package com.processlens.core.identification;

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

import java.util.Objects;

/**
 * First-order-lag step response {@code y(t) = K·(1 − e^(−t/τ)) + y0} with its
 * analytic Jacobian, for use by a least-squares optimizer.
 *
 * <p>
 * Parameter vector order: {@code [K, τ, y0]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FirstOrderModel implements MultivariateJacobianFunction {

    static final int GAIN = 0;
    static final int TIME_CONSTANT = 1;
    static final int INITIAL_VALUE = 2;

    private final double[] times;

    /**
     * @param times sample times in seconds from the start of the window
     */
    public FirstOrderModel(double[] times) {
        this.times = Objects.requireNonNull(times, "times must not be null").clone();
    }

    /**
     * @param t    seconds since the window start
     * @param gain K
     * @param tau  τ, must be positive
     * @param y0   initial level
     * @return model value at {@code t}
     */
    public static double value(double t, double gain, double tau, double y0) {
        return gain * (1 - Math.exp(-t / tau)) + y0;
    }

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
        double gain = point.getEntry(GAIN);
        double tau = point.getEntry(TIME_CONSTANT);
        double y0 = point.getEntry(INITIAL_VALUE);

        RealVector value = new ArrayRealVector(times.length);
        RealMatrix jacobian = new Array2DRowRealMatrix(times.length, 3);

        for (int i = 0; i < times.length; i++) {
            double t = times[i];
            double decay = Math.exp(-t / tau);
            value.setEntry(i, gain * (1 - decay) + y0);
            jacobian.setEntry(i, GAIN, 1 - decay);
            jacobian.setEntry(i, TIME_CONSTANT, -gain * decay * t / (tau * tau));
            jacobian.setEntry(i, INITIAL_VALUE, 1.0);
        }
        return new Pair<>(value, jacobian);
    }
}
