package com.processlens.core.stats;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.SeriesStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeriesStatisticsCalculator}.
 */
class SeriesStatisticsCalculatorTest {

    @Test
    @DisplayName("Should describe a series and count missing values")
    void shouldDescribeSeries() {
        SeriesStatistics s = SeriesStatisticsCalculator.describe("a", new double[] { 1, 2, 3, 4, Double.NaN });

        assertThat(s.getCount()).isEqualTo(4);
        assertThat(s.getMean()).isCloseTo(2.5, within(1e-12));
        assertThat(s.getStd()).isCloseTo(1.2909944, within(1e-6));
        assertThat(s.getMin()).isEqualTo(1.0);
        assertThat(s.getP25()).isCloseTo(1.75, within(1e-12));
        assertThat(s.getMedian()).isCloseTo(2.5, within(1e-12));
        assertThat(s.getP75()).isCloseTo(3.25, within(1e-12));
        assertThat(s.getMax()).isEqualTo(4.0);
        assertThat(s.getMissingRate()).isCloseTo(0.2, within(1e-12));
        assertThat(s.getSkewness()).isCloseTo(0.0, within(1e-12));
        assertThat(s.getKurtosis()).isCloseTo(-1.2, within(1e-9));
    }

    @Test
    @DisplayName("Should leave every statistic undefined for an all-missing series")
    void shouldHandleAllMissing() {
        SeriesStatistics s = SeriesStatisticsCalculator.describe("gap", new double[] { Double.NaN, Double.NaN });

        assertThat(s.getCount()).isZero();
        assertThat(s.getMean()).isNaN();
        assertThat(s.getMedian()).isNaN();
        assertThat(s.getMissingRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report an undefined missing rate for an empty window")
    void shouldHandleEmptyWindow() {
        SeriesStatistics s = SeriesStatisticsCalculator.describe("none", new double[0]);

        assertThat(s.getCount()).isZero();
        assertThat(s.getMissingRate()).isNaN();
    }

    @Test
    @DisplayName("Should leave the standard deviation undefined for a single value")
    void shouldHandleSingleValue() {
        SeriesStatistics s = SeriesStatisticsCalculator.describe("one", new double[] { 7 });

        assertThat(s.getMean()).isEqualTo(7.0);
        assertThat(s.getStd()).isNaN();
        assertThat(s.getP25()).isEqualTo(7.0);
        assertThat(s.getP75()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Should describe every series of a dataset in column order")
    void shouldDescribeDataset() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("z", new double[] { 1, 2 });
        columns.put("a", new double[] { Double.NaN, 5 });
        Dataset dataset = new Dataset(
                List.of(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 1, 0, 1)),
                columns, Map.of());

        List<SeriesStatistics> stats = SeriesStatisticsCalculator.describe(dataset);

        assertThat(stats).extracting(SeriesStatistics::getSeriesName).containsExactly("z", "a");
        assertThat(stats.get(1).getMissingRate()).isEqualTo(0.5);
    }
}
