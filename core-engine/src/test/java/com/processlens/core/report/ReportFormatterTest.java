package com.processlens.core.report;

import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.model.CausalityResult;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import com.processlens.core.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportFormatter}.
 */
class ReportFormatterTest {

    @ParameterizedTest(name = "{0} with {1} digits -> {2}")
    @CsvSource({
            "2.5, 6, 2.5",
            "12345.678, 4, 1.235e+04",
            "0.000012346, 4, 1.235e-05",
            "100, 4, 100",
            "0.0001, 4, 0.0001",
            "-3.14159, 3, -3.14",
            "0, 4, 0"
    })
    @DisplayName("Should format numbers with significant digits")
    void shouldFormatSignificant(double value, int digits, String expected) {
        assertThat(ReportFormatter.significant(value, digits)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should print nan and inf for non-finite numbers")
    void shouldFormatNonFinite() {
        assertThat(ReportFormatter.significant(Double.NaN, 4)).isEqualTo("nan");
        assertThat(ReportFormatter.significant(Double.NEGATIVE_INFINITY, 4)).isEqualTo("-inf");
        assertThat(ReportFormatter.fixed(Double.NaN, 4)).isEqualTo("nan");
        assertThat(ReportFormatter.fixed(0.5, 3)).isEqualTo("0.500");
    }

    @Test
    @DisplayName("Should print causality lines for ranked and failed pairs")
    void shouldFormatCausality() {
        assertThat(ReportFormatter.causality(CausalityResult.of("x", "y", 2, 0.0123)))
                .isEqualTo("x -> y : best_lag=2, pvalue=0.0123");
        assertThat(ReportFormatter.causality(CausalityResult.failed("y", "x", "singular matrix")))
                .isEqualTo("y -> x : error singular matrix");
    }

    @Test
    @DisplayName("Should print sections in analysis order with a header")
    void shouldFormatReport() {
        AnalysisEngine engine = new AnalysisEngine(AnalysisConfig.defaults());
        AnalysisReport report = engine.analyze(AnalysisEngineTest.plant(120), AnalysisRequest.builder()
                .select("valve", "flow")
                .analyses(AnalysisKind.CAUSALITY, AnalysisKind.STATISTICS, AnalysisKind.FUZZY_RULES)
                .build());

        String text = ReportFormatter.format(report);

        assertThat(text).startsWith("Selection: valve, flow" + System.lineSeparator()
                + "Window: " + TimeWindow.ALL + System.lineSeparator()
                + "Rows: 120 (120 after cleaning)");
        assertThat(text.indexOf("=== Descriptive statistics ==="))
                .isPositive()
                .isLessThan(text.indexOf("=== Fuzzy rules (quantile method) ==="));
        assertThat(text.indexOf("=== Fuzzy rules (quantile method) ==="))
                .isLessThan(text.indexOf("=== Granger-style predictability"));
        assertThat(text).contains("1. IF valve=").contains("valve -> flow : best_lag=");
        assertThat(text).doesNotContain("Pearson correlation matrix");
    }

    @Test
    @DisplayName("Should print only the preparation error when the selection is invalid")
    void shouldFormatPreparationError() {
        AnalysisReport report = AnalysisReport.builder(AnalysisRequest.builder().select("ghost").build())
                .preparationError(Outcome.failure(ErrorKind.SELECTION, "ghost", "unknown series").getError())
                .build();

        List<String> lines = ReportFormatter.format(report).lines().toList();

        assertThat(lines).containsExactly(
                "Selection: ghost",
                "Window: " + TimeWindow.ALL,
                "[SELECTION] ghost: unknown series");
    }

    @Test
    @DisplayName("Should print a failed section as its error")
    void shouldFormatFailedSection() {
        AnalysisReport report = AnalysisReport.builder(AnalysisRequest.builder().select("a").build())
                .section(AnalysisKind.CORRELATION,
                        Outcome.failure(ErrorKind.SELECTION, "correlation", "select at least 2 series"))
                .build();

        assertThat(ReportFormatter.block(AnalysisKind.CORRELATION, report)).containsExactly(
                "=== Pearson correlation matrix ===",
                "[SELECTION] correlation: select at least 2 series");
        assertThat(ReportFormatter.block(AnalysisKind.CAUSALITY, report)).endsWith("(not run)");
    }
}
