package com.processlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Mined rule {@code IF inputs=antecedent THEN output=consequent} with its
 * support count.
 *
 * @since 1.0.0
 */
public final class FuzzyRule {

    private final List<FuzzyLabel> antecedent;
    private final FuzzyLabel consequent;
    private final int support;

    /**
     * @param antecedent one label per input series, in selection order
     * @param consequent label of the output series
     * @param support    number of rows matching both
     */
    public FuzzyRule(List<FuzzyLabel> antecedent, FuzzyLabel consequent, int support) {
        this.antecedent = List.copyOf(Objects.requireNonNull(antecedent, "antecedent must not be null"));
        this.consequent = Objects.requireNonNull(consequent, "consequent must not be null");
        if (support < 0) {
            throw new IllegalArgumentException("support must be >= 0, got: " + support);
        }
        this.support = support;
    }

    public List<FuzzyLabel> getAntecedent() {
        return antecedent;
    }

    public FuzzyLabel getConsequent() {
        return consequent;
    }

    public int getSupport() {
        return support;
    }

    /**
     * Render the rule with series names.
     *
     * @param inputs input series names, same order as the antecedent
     * @param output output series name
     * @return e.g. {@code IF a=low AND b=high THEN c=medium}
     */
    public String describe(List<String> inputs, String output) {
        StringBuilder sb = new StringBuilder("IF ");
        for (int i = 0; i < antecedent.size(); i++) {
            if (i > 0) {
                sb.append(" AND ");
            }
            sb.append(inputs.get(i)).append('=').append(antecedent.get(i));
        }
        return sb.append(" THEN ").append(output).append('=').append(consequent).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FuzzyRule that))
            return false;
        return support == that.support
                && antecedent.equals(that.antecedent)
                && consequent == that.consequent;
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedent, consequent, support);
    }

    @Override
    public String toString() {
        return "FuzzyRule{" + antecedent + " -> " + consequent + ", support=" + support + '}';
    }
}
