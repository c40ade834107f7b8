package com.processlens.core.fuzzy;

import com.processlens.core.model.FuzzyRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rules mined for one (inputs, output) selection over one window, ordered by
 * descending support.
 *
 * @since 1.0.0
 */
public final class FuzzyRuleSet {

    private final List<String> inputs;
    private final String output;
    private final List<FuzzyRule> rules;
    private final int distinctRules;
    private final int rowCount;
    private final Map<String, double[]> thresholds;

    /**
     * @param inputs        input series, in selection order
     * @param output        output series
     * @param rules         top rules, already ordered
     * @param distinctRules number of distinct rules before truncation
     * @param rowCount      rows the rules were mined from
     * @param thresholds    series name to {@code [low, high]} quantile
     *                      thresholds
     */
    public FuzzyRuleSet(List<String> inputs, String output, List<FuzzyRule> rules,
            int distinctRules, int rowCount, Map<String, double[]> thresholds) {
        this.inputs = List.copyOf(inputs);
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.rules = List.copyOf(rules);
        this.distinctRules = distinctRules;
        this.rowCount = rowCount;
        Map<String, double[]> copy = new LinkedHashMap<>();
        thresholds.forEach((k, v) -> copy.put(k, v.clone()));
        this.thresholds = Collections.unmodifiableMap(copy);
    }

    public List<String> getInputs() {
        return inputs;
    }

    public String getOutput() {
        return output;
    }

    public List<FuzzyRule> getRules() {
        return rules;
    }

    public int getDistinctRules() {
        return distinctRules;
    }

    public int getRowCount() {
        return rowCount;
    }

    public Map<String, double[]> getThresholds() {
        return thresholds;
    }

    @Override
    public String toString() {
        return "FuzzyRuleSet{inputs=" + inputs + ", output=" + output + ", rules=" + rules.size()
                + "/" + distinctRules + ", rows=" + rowCount + '}';
    }
}
