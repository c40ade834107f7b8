package com.processlens.core.fuzzy;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.FuzzyLabel;
import com.processlens.core.model.FuzzyRule;
import com.processlens.core.model.Outcome;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Quantile-based fuzzy rule mining.
 *
 * <p>
 * The last series of the dataset is the output, the others are inputs. Each
 * value is labeled {@code low} at or below the low quantile, {@code high} at
 * or above the high quantile, {@code medium} otherwise. Every row
 * contributes one count to the rule formed by its input labels and output
 * label. Rules are ordered by descending support; equal supports keep the
 * order in which the rules were first seen.
 * </p>
 *
 * <p>
 * Thresholds come from the same rows that are mined.
 * </p>
 *
 * @since 1.0.0
 */
public class FuzzyRuleMiner {

    private static final Logger LOG = LoggerFactory.getLogger(FuzzyRuleMiner.class);

    static final int MIN_ROWS = 2;

    private final double lowQuantile;
    private final double highQuantile;
    private final int defaultTopK;

    /**
     * @param config analysis configuration; must not be {@code null}
     */
    public FuzzyRuleMiner(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.lowQuantile = config.getLowQuantile();
        this.highQuantile = config.getHighQuantile();
        this.defaultTopK = config.getFuzzyTopK();
    }

    public Outcome<FuzzyRuleSet> mine(Dataset cleaned) {
        return mine(cleaned, defaultTopK);
    }

    /**
     * @param cleaned dataset without missing values; series order defines
     *                inputs and output
     * @param topK    maximum number of rules returned
     * @return rule set, or a selection or data-sufficiency failure
     */
    public Outcome<FuzzyRuleSet> mine(Dataset cleaned, int topK) {
        Objects.requireNonNull(cleaned, "dataset must not be null");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1, got: " + topK);
        }
        List<String> names = cleaned.getSeriesNames();
        if (names.size() < 2) {
            return Outcome.failure(ErrorKind.SELECTION, "fuzzy-rules",
                    "select at least 2 series (inputs first, output last)");
        }
        if (cleaned.rowCount() < MIN_ROWS) {
            return Outcome.failure(ErrorKind.DATA_SUFFICIENCY, "fuzzy-rules", "insufficient data");
        }

        List<String> inputs = names.subList(0, names.size() - 1);
        String output = names.get(names.size() - 1);

        Map<String, double[]> thresholds = new LinkedHashMap<>();
        Map<String, FuzzyLabel[]> labels = new LinkedHashMap<>();
        for (String name : names) {
            double[] values = cleaned.getValues(name);
            double[] t = thresholds(values);
            thresholds.put(name, t);
            labels.put(name, fuzzify(values, t[0], t[1]));
        }

        Map<RuleKey, Integer> support = new LinkedHashMap<>();
        for (int row = 0; row < cleaned.rowCount(); row++) {
            List<FuzzyLabel> antecedent = new ArrayList<>(inputs.size());
            for (String input : inputs) {
                antecedent.add(labels.get(input)[row]);
            }
            support.merge(new RuleKey(antecedent, labels.get(output)[row]), 1, Integer::sum);
        }

        // stable sort keeps first-seen order among equal supports
        List<FuzzyRule> rules = new ArrayList<>(support.size());
        support.forEach((key, count) -> rules.add(new FuzzyRule(key.antecedent, key.consequent, count)));
        rules.sort(Comparator.comparingInt(FuzzyRule::getSupport).reversed());

        if (LOG.isDebugEnabled()) {
            LOG.debug("Mined {} distinct rule(s) from {} row(s), thresholds={}", rules.size(),
                    cleaned.rowCount(), thresholdsText(thresholds));
        }
        return Outcome.success(new FuzzyRuleSet(inputs, output,
                rules.subList(0, Math.min(topK, rules.size())), rules.size(), cleaned.rowCount(), thresholds));
    }

    /**
     * @param values series values
     * @return {@code [low, high]} quantiles (linear interpolation between
     *         order statistics)
     */
    double[] thresholds(double[] values) {
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(values);
        return new double[] {
                percentile.evaluate(lowQuantile * 100.0),
                percentile.evaluate(highQuantile * 100.0) };
    }

    static FuzzyLabel[] fuzzify(double[] values, double low, double high) {
        FuzzyLabel[] out = new FuzzyLabel[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = label(values[i], low, high);
        }
        return out;
    }

    static FuzzyLabel label(double value, double low, double high) {
        if (value <= low) {
            return FuzzyLabel.LOW;
        }
        if (value >= high) {
            return FuzzyLabel.HIGH;
        }
        return FuzzyLabel.MEDIUM;
    }

    private static String thresholdsText(Map<String, double[]> thresholds) {
        return thresholds.entrySet().stream()
                .map(e -> e.getKey() + "=" + Arrays.toString(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static final class RuleKey {
        private final List<FuzzyLabel> antecedent;
        private final FuzzyLabel consequent;

        RuleKey(List<FuzzyLabel> antecedent, FuzzyLabel consequent) {
            this.antecedent = List.copyOf(antecedent);
            this.consequent = consequent;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof RuleKey that))
                return false;
            return antecedent.equals(that.antecedent) && consequent == that.consequent;
        }

        @Override
        public int hashCode() {
            return Objects.hash(antecedent, consequent);
        }
    }
}
