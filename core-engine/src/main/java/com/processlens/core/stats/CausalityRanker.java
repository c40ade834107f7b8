package com.processlens.core.stats;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.model.CausalityResult;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Best-lag predictability ranking for every ordered pair of series.
 *
 * <p>
 * {@code maxlag = clamp(rows / divisor, 1, maxCausalityLag)}. For each pair
 * {@code (x, y)} with {@code x ≠ y}, lags {@code 1..maxlag} are tested and the
 * lag with the smallest p-value is reported; equal p-values keep the smaller
 * lag. No multiple-comparison correction is applied. A failure for one pair
 * is recorded on that pair and the remaining pairs still run.
 * </p>
 *
 * @since 1.0.0
 */
public class CausalityRanker {

    private static final Logger LOG = LoggerFactory.getLogger(CausalityRanker.class);

    private final PredictabilityTest test;
    private final int maxLag;
    private final int lagDivisor;

    public CausalityRanker(AnalysisConfig config) {
        this(config, new GrangerFTest());
    }

    /**
     * @param config analysis configuration; must not be {@code null}
     * @param test   predictability test; must not be {@code null}
     */
    public CausalityRanker(AnalysisConfig config, PredictabilityTest test) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.test = Objects.requireNonNull(test, "PredictabilityTest must not be null");
        this.maxLag = config.getMaxCausalityLag();
        this.lagDivisor = config.getCausalityLagDivisor();
    }

    /**
     * @param cleaned dataset without missing values; series order defines
     *                pair order
     * @return one result per ordered pair, or a selection / data-sufficiency
     *         failure
     */
    public Outcome<List<CausalityResult>> rank(Dataset cleaned) {
        Objects.requireNonNull(cleaned, "dataset must not be null");
        List<String> names = cleaned.getSeriesNames();
        if (names.size() < 2) {
            return Outcome.failure(ErrorKind.SELECTION, "causality", "select at least 2 series");
        }
        if (cleaned.rowCount() == 0) {
            return Outcome.failure(ErrorKind.DATA_SUFFICIENCY, "causality",
                    "insufficient data for the causality test");
        }

        int lags = maxLagFor(cleaned.rowCount());
        List<CausalityResult> results = new ArrayList<>();
        for (String source : names) {
            for (String target : names) {
                if (!source.equals(target)) {
                    results.add(rankPair(source, target,
                            cleaned.getValues(source), cleaned.getValues(target), lags));
                }
            }
        }
        LOG.debug("Causality ranking over {} row(s), maxlag={}: {} pair(s)",
                cleaned.rowCount(), lags, results.size());
        return Outcome.success(results);
    }

    int maxLagFor(int rows) {
        return Math.min(maxLag, Math.max(1, rows / lagDivisor));
    }

    private CausalityResult rankPair(String source, String target, double[] x, double[] y, int lags) {
        if (!test.supports(y.length, lags)) {
            return CausalityResult.failed(source, target, "insufficient observations (" + y.length
                    + " rows) for maxlag " + lags);
        }
        int bestLag = -1;
        double bestP = Double.NaN;
        try {
            for (int lag = 1; lag <= lags; lag++) {
                double p = test.pValue(y, x, lag);
                if (!Double.isNaN(p) && (bestLag < 0 || p < bestP)) {
                    bestLag = lag;
                    bestP = p;
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Causality test failed for {} -> {}: {}", source, target, e.getMessage());
            return CausalityResult.failed(source, target, String.valueOf(e.getMessage()));
        }
        if (bestLag < 0) {
            return CausalityResult.failed(source, target, "no lag produced a p-value");
        }
        return CausalityResult.of(source, target, bestLag, bestP);
    }
}
