package com.processlens.runner;

import com.processlens.core.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunnerConfig}.
 */
class RunnerConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variable is set")
    void shouldApplyDefaults() {
        RunnerConfig config = RunnerConfig.fromEnvironment(Map.of(), List.of("a.csv"));

        assertThat(config.getInputFiles()).containsExactly(Path.of("a.csv"));
        assertThat(config.getSelection()).isEmpty();
        assertThat(config.getWindow()).isEqualTo(TimeWindow.ALL);
        assertThat(config.getResamplePeriod()).isNull();
        assertThat(config.getAnalyses()).isEmpty();
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getReportJsonPath()).isNull();
    }

    @Test
    @DisplayName("Should resolve every variable")
    void shouldResolveVariables() {
        Map<String, String> env = Map.of(
                RunnerConfig.ENV_SELECTION, " plant_valve , plant_flow ,",
                RunnerConfig.ENV_WINDOW_START, "2024-01-01 08:00:00",
                RunnerConfig.ENV_WINDOW_END, "2024-01-01T09:30:00",
                RunnerConfig.ENV_RESAMPLE_PERIOD, "5T",
                RunnerConfig.ENV_AGGREGATOR, "median",
                RunnerConfig.ENV_ANALYSES, "statistics,causality",
                RunnerConfig.ENV_PARALLELISM, "4",
                RunnerConfig.ENV_EXPORT_PATH, "out/selection.csv",
                RunnerConfig.ENV_REPORT_JSON_PATH, "out/report.json");

        RunnerConfig config = RunnerConfig.fromEnvironment(env, List.of("a.csv", "b.csv"));

        assertThat(config.getInputFiles()).hasSize(2);
        assertThat(config.getSelection()).containsExactly("plant_valve", "plant_flow");
        assertThat(config.getWindow()).isEqualTo(TimeWindow.of(
                LocalDateTime.of(2024, 1, 1, 8, 0), LocalDateTime.of(2024, 1, 1, 9, 30)));
        assertThat(config.getResamplePeriod()).isEqualTo("5T");
        assertThat(config.getAggregator()).isEqualTo("median");
        assertThat(config.getAnalyses()).containsExactly("statistics", "causality");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getExportPath()).isEqualTo(Path.of("out/selection.csv"));
        assertThat(config.getReportJsonPath()).isEqualTo(Path.of("out/report.json"));
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankValues() {
        RunnerConfig config = RunnerConfig.fromEnvironment(
                Map.of(RunnerConfig.ENV_PARALLELISM, "  ", RunnerConfig.ENV_EXPORT_PATH, ""), List.of("a.csv"));

        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getExportPath()).isNull();
    }

    @Test
    @DisplayName("Should reject a non-numeric parallelism")
    void shouldRejectBadNumber() {
        assertThatThrownBy(() -> RunnerConfig.fromEnvironment(
                Map.of(RunnerConfig.ENV_PARALLELISM, "many"), List.of("a.csv")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should reject an unparseable window bound")
    void shouldRejectBadTimestamp() {
        assertThatThrownBy(() -> RunnerConfig.fromEnvironment(
                Map.of(RunnerConfig.ENV_WINDOW_START, "last tuesday"), List.of("a.csv")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(RunnerConfig.ENV_WINDOW_START);
    }

    @Test
    @DisplayName("Should reject a window whose start is after its end")
    void shouldRejectInvertedWindow() {
        assertThatThrownBy(() -> RunnerConfig.builder()
                .inputFile(Path.of("a.csv"))
                .window(LocalDateTime.of(2024, 1, 2, 0, 0), LocalDateTime.of(2024, 1, 1, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should require input files and a positive parallelism")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> RunnerConfig.builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input");
        assertThatThrownBy(() -> RunnerConfig.builder().inputFile(Path.of("a.csv")).parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }
}
