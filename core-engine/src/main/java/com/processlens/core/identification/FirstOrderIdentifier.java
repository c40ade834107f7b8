package com.processlens.core.identification;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.detection.StepDetector;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.FittedStepModel;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.StepWindow;
import com.processlens.core.model.TuningRecommendation;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fits a first-order-lag model to a detected step and derives tuning values.
 *
 * <h3>Per-series processing</h3>
 * <ol>
 * <li>Series shorter than {@code minStepSeriesLength} → {@code TOO_SHORT}.</li>
 * <li>No step window → {@code NO_STEP_FOUND}. Only the first window is
 * used.</li>
 * <li>Window shorter than {@code minFitSamples} → {@code TOO_SHORT}.</li>
 * <li>Steady values: mean of {@code vals[max(0, s − n) .. s]} before the
 * step and of {@code vals[e .. min(len − 1, e + n)]} after it, with
 * {@code n = steadyStateSamples}.</li>
 * <li>Levenberg–Marquardt fit from {@code K = post − pre},
 * {@code τ = max(1 s, duration / 3)}, {@code y0 = pre}. τ is kept at or
 * above {@value #MIN_TIME_CONSTANT} during the search.</li>
 * </ol>
 *
 * <p>
 * Optimizer failures are reported as {@code FIT_FAILED}; they never escape
 * this class. Instances are stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class FirstOrderIdentifier {

    private static final Logger LOG = LoggerFactory.getLogger(FirstOrderIdentifier.class);

    static final double MIN_TIME_CONSTANT = 1e-6;
    static final double MIN_INITIAL_TIME_CONSTANT = 1.0;

    private final StepDetector detector;
    private final int minSeriesLength;
    private final int minFitSamples;
    private final int steadyStateSamples;
    private final int maxEvaluations;

    /**
     * @param config analysis configuration; must not be {@code null}
     */
    public FirstOrderIdentifier(AnalysisConfig config) {
        this(config, new StepDetector(config));
    }

    /**
     * @param config   analysis configuration; must not be {@code null}
     * @param detector step detector used to locate the window
     */
    public FirstOrderIdentifier(AnalysisConfig config, StepDetector detector) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.detector = Objects.requireNonNull(detector, "StepDetector must not be null");
        this.minSeriesLength = config.getMinStepSeriesLength();
        this.minFitSamples = config.getMinFitSamples();
        this.steadyStateSamples = config.getSteadyStateSamples();
        this.maxEvaluations = config.getMaxFitEvaluations();
    }

    // ---------------------------------------------------------------
    // Per-series pipeline
    // ---------------------------------------------------------------

    /**
     * Detect the first step in a series and identify it.
     *
     * @param seriesName series name
     * @param times      timestamps of a cleaned series
     * @param values     values without missing entries
     * @return terminal result; never {@code null}
     */
    public StepIdentificationResult identify(String seriesName, List<LocalDateTime> times, double[] values) {
        Objects.requireNonNull(seriesName, "seriesName must not be null");
        if (values.length < minSeriesLength) {
            return StepIdentificationResult.tooShort(seriesName,
                    "too few samples (" + values.length + " < " + minSeriesLength + "), skipped");
        }
        List<StepWindow> windows = detector.detect(seriesName, times, values);
        if (windows.isEmpty()) {
            LOG.debug("No step detected in '{}'", seriesName);
            return StepIdentificationResult.noStepFound(seriesName);
        }
        return identify(windows.get(0), times, values);
    }

    /**
     * Identify a single window.
     *
     * @param window window within {@code values}
     * @param times  timestamps of the whole series
     * @param values values of the whole series
     * @return terminal result; never {@code null}
     */
    public StepIdentificationResult identify(StepWindow window, List<LocalDateTime> times, double[] values) {
        Objects.requireNonNull(window, "window must not be null");
        String name = window.getSeriesName();
        int start = window.getStartIndex();
        int end = window.getEndIndex();
        if (window.length() < minFitSamples) {
            return StepIdentificationResult.builder(name, StepIdentificationStatus.TOO_SHORT)
                    .window(window)
                    .message("detected step window too short to fit (" + window.length()
                            + " < " + minFitSamples + " samples)")
                    .build();
        }

        double pre = mean(values, Math.max(0, start - steadyStateSamples), start);
        double post = mean(values, end, Math.min(values.length - 1, end + steadyStateSamples));

        double[] t = secondsFrom(times, start, end);
        double[] y = Arrays.copyOfRange(values, start, end + 1);
        double[] guess = {
                post - pre,
                Math.max(MIN_INITIAL_TIME_CONSTANT, (t[t.length - 1] - t[0]) / 3.0),
                pre
        };

        Outcome<FittedStepModel> fit = fit(name, t, y, guess);
        if (!fit.isSuccess()) {
            return StepIdentificationResult.builder(name, StepIdentificationStatus.FIT_FAILED)
                    .window(window)
                    .steadyValues(pre, post)
                    .message(fit.getError().getMessage())
                    .build();
        }

        FittedStepModel model = fit.getValue();
        TuningRecommendation tuning = TuningHeuristic.recommend(model);
        double[] fitted = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            fitted[i] = model.valueAt(t[i]);
        }
        StepOverlay overlay = new StepOverlay(name, times, values,
                times.subList(start, end + 1), fitted, times.get(start));

        LOG.debug("Identified '{}': {} -> {}", name, model, tuning);
        return StepIdentificationResult.builder(name, StepIdentificationStatus.FIT_SUCCEEDED)
                .window(window)
                .steadyValues(pre, post)
                .model(model)
                .tuning(tuning)
                .overlay(overlay)
                .build();
    }

    // ---------------------------------------------------------------
    // Curve fit
    // ---------------------------------------------------------------

    /**
     * Least-squares fit of {@code y(t) = K·(1 − e^(−t/τ)) + y0}.
     *
     * @param subject name used in error reports
     * @param t       sample times in seconds from the window start
     * @param y       sample values
     * @param guess   initial {@code [K, τ, y0]}
     * @return fitted model with R², or a {@link ErrorKind#NUMERICAL} failure
     */
    public Outcome<FittedStepModel> fit(String subject, double[] t, double[] y, double[] guess) {
        Objects.requireNonNull(t, "t must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (t.length != y.length) {
            throw new IllegalArgumentException("t and y differ in length: " + t.length + " vs " + y.length);
        }
        if (guess.length != 3) {
            throw new IllegalArgumentException("initial guess needs 3 parameters, got " + guess.length);
        }

        ParameterValidator validator = params -> {
            double tau = Math.max(MIN_TIME_CONSTANT, params.getEntry(FirstOrderModel.TIME_CONSTANT));
            return new ArrayRealVector(new double[] {
                    params.getEntry(FirstOrderModel.GAIN), tau, params.getEntry(FirstOrderModel.INITIAL_VALUE) });
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(guess)
                .model(new FirstOrderModel(t))
                .target(y)
                .parameterValidator(validator)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxEvaluations)
                .build();

        double[] p;
        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            p = optimum.getPoint().toArray();
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            LOG.warn("First-order fit failed for '{}': {}", subject, e.getMessage());
            return Outcome.failure(ErrorKind.NUMERICAL, subject, "fit failed: " + e.getMessage());
        }

        double gain = p[FirstOrderModel.GAIN];
        double tau = p[FirstOrderModel.TIME_CONSTANT];
        double y0 = p[FirstOrderModel.INITIAL_VALUE];
        if (!Double.isFinite(gain) || !Double.isFinite(tau) || !Double.isFinite(y0)) {
            LOG.warn("First-order fit for '{}' produced non-finite parameters", subject);
            return Outcome.failure(ErrorKind.NUMERICAL, subject, "fit failed: non-finite parameters");
        }
        return Outcome.success(new FittedStepModel(gain, tau, y0, rSquared(t, y, gain, tau, y0)));
    }

    /**
     * @return {@code 1 − SSres/SStot}, or {@code NaN} when {@code SStot} is zero
     */
    static double rSquared(double[] t, double[] y, double gain, double tau, double y0) {
        double mean = mean(y, 0, y.length - 1);
        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - FirstOrderModel.value(t[i], gain, tau, y0);
            ssRes += residual * residual;
            double deviation = y[i] - mean;
            ssTot += deviation * deviation;
        }
        return ssTot == 0 ? Double.NaN : 1 - ssRes / ssTot;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i <= to; i++) {
            sum += values[i];
        }
        return sum / (to - from + 1);
    }

    private static double[] secondsFrom(List<LocalDateTime> times, int start, int end) {
        LocalDateTime origin = times.get(start);
        double[] t = new double[end - start + 1];
        for (int i = start; i <= end; i++) {
            t[i - start] = Duration.between(origin, times.get(i)).toNanos() / 1e9;
        }
        return t;
    }
}
