package com.processlens.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load test config from classpath and keep unset defaults")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getMinStepSeriesLength()).isEqualTo(40);
        assertThat(config.getPeakDistance()).isEqualTo(4);
        assertThat(config.getFuzzyTopK()).isEqualTo(5);
        assertThat(config.getResamplePeriod()).isEqualTo("10S");
        assertThat(config.getAggregator()).isEqualTo("median");
        assertThat(config.getAnalyses()).containsExactly("statistics", "fuzzy-rules");
        // untouched keys keep their defaults
        assertThat(config.getStepHalfWidth()).isEqualTo(8);
        assertThat(config.getMadMultiplier()).isEqualTo(3.0);
        assertThat(config.getLowQuantile()).isEqualTo(0.33);
    }

    @Test
    @DisplayName("Should load the bundled default config")
    void shouldLoadBundledDefaults() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getMinStepSeriesLength()).isEqualTo(30);
        assertThat(config.getMaxFitEvaluations()).isEqualTo(10_000);
        assertThat(config.getResamplePeriod()).isNull();
        assertThat(config.getAnalyses()).containsExactlyElementsOf(AnalysisConfig.ANALYSIS_NAMES);
    }

    @Test
    @DisplayName("Should report every validation problem at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'peakDistance' must be >= 1")
                .hasMessageContaining("lowQuantile < highQuantile")
                .hasMessageContaining("Unknown analysis: 'clustering'");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist on the classpath");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("custom.yml");
        Files.writeString(file, "peakDistance: 7\nmaxCausalityLag: 3\n");

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getPeakDistance()).isEqualTo(7);
        assertThat(config.getMaxCausalityLag()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "peakDistance: 7\npeakDistance: 8\n");

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed analysis config " + file);
    }

    @Test
    @DisplayName("Should throw when the config file is missing")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Analysis config file does not exist");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "# nothing configured yet\n");

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getPeakDistance()).isEqualTo(AnalysisConfig.defaults().getPeakDistance());
        assertThat(config.getAnalyses()).isEqualTo(AnalysisConfig.defaults().getAnalyses());
    }
}
