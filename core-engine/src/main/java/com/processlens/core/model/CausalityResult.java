package com.processlens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Best-lag predictability result for one ordered pair, or the error that
 * prevented it.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CausalityResult {

    private final String source;
    private final String target;
    private final Integer bestLag;
    private final Double pValue;
    private final String error;

    private CausalityResult(String source, String target, Integer bestLag, Double pValue, String error) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.bestLag = bestLag;
        this.pValue = pValue;
        this.error = error;
    }

    /**
     * @param source  series whose past is tested as a predictor
     * @param target  series being predicted
     * @param bestLag lag with the smallest p-value
     * @param pValue  that p-value
     * @return a successful result
     */
    public static CausalityResult of(String source, String target, int bestLag, double pValue) {
        return new CausalityResult(source, target, bestLag, pValue, null);
    }

    public static CausalityResult failed(String source, String target, String error) {
        return new CausalityResult(source, target, null, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    /**
     * @return best lag, or {@code null} for a failed pair
     */
    public Integer getBestLag() {
        return bestLag;
    }

    /**
     * @return p-value at the best lag, or {@code null} for a failed pair
     */
    public Double getPValue() {
        return pValue;
    }

    /**
     * @return error text, or {@code null} for a successful pair
     */
    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CausalityResult that))
            return false;
        return source.equals(that.source) && target.equals(that.target)
                && Objects.equals(bestLag, that.bestLag)
                && Objects.equals(pValue, that.pValue)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, bestLag, pValue, error);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? source + " -> " + target + " : best_lag=" + bestLag + ", pvalue=" + pValue
                : source + " -> " + target + " : error " + error;
    }
}
