package com.processlens.core.report;

import com.processlens.core.fuzzy.FuzzyRuleSet;
import com.processlens.core.identification.StepIdentificationResult;
import com.processlens.core.model.CausalityResult;
import com.processlens.core.model.CorrelationMatrix;
import com.processlens.core.model.FittedStepModel;
import com.processlens.core.model.FuzzyRule;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.SeriesStatistics;
import com.processlens.core.model.TuningRecommendation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link AnalysisReport} as plain monospace text.
 *
 * <p>
 * One block per analysis, in {@link AnalysisKind} order. Line order inside a
 * block follows the selection order, so two reports for the same request are
 * identical.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportFormatter {

    private static final String NAN = "nan";

    private ReportFormatter() {
        // utility class — not instantiable
    }

    /**
     * @param report report to render
     * @return the full text, blocks separated by blank lines
     */
    public static String format(AnalysisReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("Selection: " + String.join(", ", report.getSelection()));
        lines.add("Window: " + report.getWindow());
        if (!report.isPrepared()) {
            lines.add(report.getPreparationError().describe());
            return String.join(System.lineSeparator(), lines) + System.lineSeparator();
        }
        lines.add("Rows: " + report.getRowCount() + " (" + report.getCleanedRowCount() + " after cleaning)");
        report.getNotes().forEach(note -> lines.add("Note: " + note));

        for (Map.Entry<AnalysisKind, Outcome<?>> section : report.getSections().entrySet()) {
            lines.add("");
            lines.addAll(block(section.getKey(), report));
        }
        return String.join(System.lineSeparator(), lines) + System.lineSeparator();
    }

    /**
     * @return the lines of one analysis block, title first
     */
    public static List<String> block(AnalysisKind kind, AnalysisReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("=== " + kind.getTitle() + " ===");
        Outcome<?> outcome = report.getSections().get(kind);
        if (outcome == null) {
            lines.add("(not run)");
            return lines;
        }
        if (!outcome.isSuccess()) {
            lines.add(outcome.getError().describe());
            return lines;
        }
        switch (kind) {
            case STATISTICS -> lines.addAll(statistics(report.getStatistics().getValue()));
            case CORRELATION -> lines.addAll(correlation(report.getCorrelation().getValue()));
            case STEP_IDENTIFICATION -> report.getStepIdentification().getValue()
                    .forEach(r -> lines.addAll(stepIdentification(r)));
            case FUZZY_RULES -> lines.addAll(fuzzyRules(report.getFuzzyRules().getValue()));
            case CAUSALITY -> report.getCausality().getValue().forEach(r -> lines.add(causality(r)));
        }
        return lines;
    }

    // ---------------------------------------------------------------
    // Blocks
    // ---------------------------------------------------------------

    static List<String> statistics(List<SeriesStatistics> stats) {
        List<String> lines = new ArrayList<>();
        int width = Math.max(6, stats.stream().mapToInt(s -> s.getSeriesName().length()).max().orElse(6));
        String header = String.format(Locale.ROOT, "%-" + width + "s %8s %12s %12s %12s %12s %12s %12s %12s %8s %10s %10s",
                "series", "count", "mean", "std", "min", "25%", "50%", "75%", "max", "missing", "skew", "kurtosis");
        lines.add(header);
        for (SeriesStatistics s : stats) {
            lines.add(String.format(Locale.ROOT, "%-" + width + "s %8d %12s %12s %12s %12s %12s %12s %12s %8s %10s %10s",
                    s.getSeriesName(), s.getCount(),
                    significant(s.getMean(), 6), significant(s.getStd(), 6), significant(s.getMin(), 6),
                    significant(s.getP25(), 6), significant(s.getMedian(), 6), significant(s.getP75(), 6),
                    significant(s.getMax(), 6), fixed(s.getMissingRate(), 4),
                    significant(s.getSkewness(), 4), significant(s.getKurtosis(), 4)));
        }
        return lines;
    }

    static List<String> correlation(CorrelationMatrix matrix) {
        List<String> labels = matrix.getLabels();
        int width = Math.max(8, labels.stream().mapToInt(String::length).max().orElse(8));
        List<String> lines = new ArrayList<>();
        StringBuilder header = new StringBuilder(" ".repeat(width));
        for (String label : labels) {
            header.append(' ').append(String.format(Locale.ROOT, "%" + width + "s", label));
        }
        lines.add(header.toString());
        for (int i = 0; i < labels.size(); i++) {
            StringBuilder row = new StringBuilder(String.format(Locale.ROOT, "%-" + width + "s", labels.get(i)));
            for (int j = 0; j < labels.size(); j++) {
                row.append(' ').append(String.format(Locale.ROOT, "%" + width + "s", fixed(matrix.get(i, j), 4)));
            }
            lines.add(row.toString());
        }
        return lines;
    }

    static List<String> stepIdentification(StepIdentificationResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("------ series: " + result.getSeriesName() + " ------");
        switch (result.getStatus()) {
            case TOO_SHORT, NO_STEP_FOUND -> lines.add(result.getMessage());
            case FIT_FAILED -> {
                stepWindowLines(result, lines);
                lines.add(result.getMessage());
            }
            case FIT_SUCCEEDED -> {
                stepWindowLines(result, lines);
                FittedStepModel m = result.getModel();
                lines.add("fit: K=" + significant(m.getGain(), 6)
                        + ", tau=" + fixed(m.getTimeConstant(), 3) + "s"
                        + ", y0=" + significant(m.getInitialValue(), 6)
                        + ", R^2=" + (m.hasRSquared() ? fixed(m.getRSquared(), 4) : "undefined"));
                TuningRecommendation t = result.getTuning();
                lines.add("dead time L ≈ " + fixed(t.getDeadTime(), 3) + "s -> suggestion (heuristic): Kp="
                        + significant(t.getProportionalGain(), 4)
                        + ", Ti=" + fixed(t.getIntegralTime(), 3)
                        + ", Td=" + fixed(t.getDerivativeTime(), 3));
            }
        }
        return lines;
    }

    private static void stepWindowLines(StepIdentificationResult result, List<String> lines) {
        lines.add("step window index: " + result.getWindow().getStartIndex() + " - "
                + result.getWindow().getEndIndex());
        lines.add("step time: " + result.getWindow().getStartTime() + " -> " + result.getWindow().getEndTime());
        lines.add("steady value before (y0) ≈ " + significant(result.getPreStepMean(), 4)
                + ", after (y_inf) ≈ " + significant(result.getPostStepMean(), 4));
    }

    static List<String> fuzzyRules(FuzzyRuleSet rules) {
        List<String> lines = new ArrayList<>();
        lines.add("inputs=" + rules.getInputs() + " -> output=" + rules.getOutput()
                + " (" + rules.getRowCount() + " rows, " + rules.getDistinctRules() + " distinct rules)");
        lines.add("format: IF <input>=<label> AND ... THEN <output>=<label> : support");
        int rank = 1;
        for (FuzzyRule rule : rules.getRules()) {
            lines.add(rank++ + ". " + rule.describe(rules.getInputs(), rules.getOutput())
                    + " : count=" + rule.getSupport());
        }
        return lines;
    }

    static String causality(CausalityResult result) {
        String pair = result.getSource() + " -> " + result.getTarget() + " : ";
        if (!result.isSuccess()) {
            return pair + "error " + result.getError();
        }
        return pair + "best_lag=" + result.getBestLag() + ", pvalue=" + significant(result.getPValue(), 4);
    }

    // ---------------------------------------------------------------
    // Number formatting
    // ---------------------------------------------------------------

    /**
     * General format with {@code digits} significant digits: positional for
     * decimal exponents in {@code [-4, digits)}, scientific otherwise;
     * trailing zeros removed.
     */
    static String significant(double value, int digits) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(digits));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= digits) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            return String.format(Locale.ROOT, "%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    static String fixed(double value, int decimals) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
