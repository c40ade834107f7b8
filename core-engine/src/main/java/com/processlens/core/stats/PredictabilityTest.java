package com.processlens.core.stats;

/**
 * Statistical test of whether past values of a source series improve the
 * prediction of a target series.
 *
 * <p>
 * A small p-value means the source is a useful predictor at that lag. This is
 * a predictability test, not evidence of physical causation.
 * </p>
 *
 * @since 1.0.0
 */
public interface PredictabilityTest {

    /**
     * @param target values of the predicted series
     * @param source values of the candidate predictor, same length
     * @param lag    number of past samples used (>= 1)
     * @return p-value of the null hypothesis "source does not help"
     * @throws IllegalArgumentException if the data cannot support the test
     *                                  at this lag
     */
    double pValue(double[] target, double[] source, int lag);

    /**
     * @param rows   available rows
     * @param maxLag largest lag that will be requested
     * @return {@code true} if every lag up to {@code maxLag} can be tested
     */
    boolean supports(int rows, int maxLag);
}
