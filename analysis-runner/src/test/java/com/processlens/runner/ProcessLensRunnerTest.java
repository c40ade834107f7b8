package com.processlens.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.processlens.core.config.AnalysisConfig;
import com.processlens.core.ingest.DatasetLoader;
import com.processlens.core.report.AnalysisKind;
import com.processlens.core.report.AnalysisReport;
import com.processlens.core.report.AnalysisRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link ProcessLensRunner} over CSV files.
 */
class ProcessLensRunnerTest {

    private static final DateTimeFormatter LAYOUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 8, 0);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load, analyse, export and write JSON for a selection")
    void shouldRunEndToEnd() throws IOException {
        Path valve = writeSeries("valve.csv", "Opening (%)", 0);
        Path flow = writeSeries("flow.csv", "Flow (m3/h)", 3);
        Path selectionCsv = dir.resolve("out").resolve("selection.csv");
        Path allCsv = dir.resolve("out").resolve("all.csv");
        Path json = dir.resolve("out").resolve("report.json");
        RunnerConfig config = RunnerConfig.builder()
                .inputFile(valve)
                .inputFile(flow)
                .selection(List.of("valve_Opening (%)", "flow_Flow (m3/h)"))
                .window(T0.plusSeconds(10), null)
                .resample("2S", "mean")
                .analyses(List.of("statistics", "fuzzy-rules", "step-identification"))
                .parallelism(2)
                .exportPath(selectionCsv)
                .exportAllPath(allCsv)
                .reportJsonPath(json)
                .build();

        AnalysisReport report = ProcessLensRunner.run(config, AnalysisConfig.defaults());

        assertThat(report.isPrepared()).isTrue();
        assertThat(report.getSections()).containsOnlyKeys(
                AnalysisKind.STATISTICS, AnalysisKind.FUZZY_RULES, AnalysisKind.STEP_IDENTIFICATION);
        assertThat(report.getRowCount()).isEqualTo(55);
        assertThat(report.getNotes()).containsExactly("resampled to 2S using mean: 55 row(s)");

        List<String> exported = Files.readAllLines(selectionCsv, StandardCharsets.UTF_8);
        assertThat(exported.get(0)).startsWith("time,")
                .contains("valve_Opening (%)")
                .contains("flow_Flow (m3/h)");
        assertThat(exported).hasSize(56);
        assertThat(Files.readAllLines(allCsv, StandardCharsets.UTF_8)).hasSize(56);

        JsonNode tree = new ObjectMapper().readTree(json.toFile());
        assertThat(tree.get("fuzzyRules").get("value").get("output").asText()).isEqualTo("flow_Flow (m3/h)");
    }

    @Test
    @DisplayName("Should analyse every loaded series when nothing is selected")
    void shouldSelectAllByDefault() throws IOException {
        Path valve = writeSeries("valve.csv", "Opening (%)", 0);
        RunnerConfig config = RunnerConfig.builder().inputFile(valve).build();

        AnalysisRequest request = ProcessLensRunner.buildRequest(config,
                new DatasetLoader().load(List.of(valve)).getDataset());

        assertThat(request.getSelection()).containsExactly("valve_Opening (%)");
        assertThat(request.getAnalyses()).isNull();
    }

    @Test
    @DisplayName("Should fail when no input file yields data")
    void shouldFailWithoutData() throws IOException {
        Path empty = Files.writeString(dir.resolve("empty.csv"), "time,v\nnever,1\n");
        RunnerConfig config = RunnerConfig.builder().inputFile(empty).build();

        assertThatThrownBy(() -> ProcessLensRunner.run(config, AnalysisConfig.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No data loaded");
    }

    /**
     * 120 one-second samples with a step at sample 50, shifted by {@code delay}.
     */
    private Path writeSeries(String file, String column, int delay) throws IOException {
        StringBuilder csv = new StringBuilder("time,").append(column).append('\n');
        for (int i = 0; i < 120; i++) {
            double value = i < 50 + delay ? 10.0 : 10.0 + 5 * (1 - Math.exp(-(i - 50 - delay) / 4.0));
            csv.append(LAYOUT.format(T0.plusSeconds(i))).append(',').append(value).append('\n');
        }
        return Files.writeString(dir.resolve(file), csv.toString());
    }
}
