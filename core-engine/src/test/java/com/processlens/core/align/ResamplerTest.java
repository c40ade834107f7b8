package com.processlens.core.align;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.ErrorKind;
import com.processlens.core.model.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Resampler}, {@link ResamplePeriod} and
 * {@link Aggregator}.
 */
class ResamplerTest {

    @ParameterizedTest
    @CsvSource({ "1S,1000", "5T,300000", "15min,900000", "1H,3600000", "100L,100", "250ms,250", "D,86400000" })
    @DisplayName("Should parse period strings")
    void shouldParsePeriods(String text, long millis) {
        assertThat(ResamplePeriod.parse(text).toMillis()).isEqualTo(millis);
    }

    @Test
    @DisplayName("Should reject malformed periods")
    void shouldRejectBadPeriods() {
        assertThatThrownBy(() -> ResamplePeriod.parse("5X")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown resample unit");
        assertThatThrownBy(() -> ResamplePeriod.parse("0S")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResamplePeriod.parse("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should aggregate with mean, skipping missing values")
    void shouldAggregateMean() {
        Dataset data = dataset(1, 3, Double.NaN, 5, 6, 7);

        Dataset out = Resampler.resample(data, ResamplePeriod.parse("3S"), Aggregator.MEAN);

        assertThat(out.getIndex()).containsExactly(t(0), t(3));
        assertThat(out.getValues("v")).containsExactly(2.0, 6.0);
    }

    @Test
    @DisplayName("Should support every aggregator")
    void shouldSupportAggregators() {
        double[] bucket = { 4, Double.NaN, 1, 9, 2 };

        assertThat(Aggregator.FIRST.apply(bucket)).isEqualTo(4);
        assertThat(Aggregator.MAX.apply(bucket)).isEqualTo(9);
        assertThat(Aggregator.MIN.apply(bucket)).isEqualTo(1);
        assertThat(Aggregator.MEDIAN.apply(bucket)).isEqualTo(3);
        assertThat(Aggregator.MEAN.apply(bucket)).isEqualTo(4);
        assertThat(Aggregator.MEAN.apply(new double[] { Double.NaN })).isNaN();
        assertThat(Aggregator.fromName(" Median ")).isEqualTo(Aggregator.MEDIAN);
    }

    @Test
    @DisplayName("Should drop buckets in which every series is missing")
    void shouldDropAllMissingBuckets() {
        Dataset data = dataset(1, Double.NaN, Double.NaN, Double.NaN, 5, 6);

        Dataset out = Resampler.resample(data, ResamplePeriod.parse("2S"), Aggregator.MAX);

        assertThat(out.getIndex()).containsExactly(t(0), t(4));
        assertThat(out.getValues("v")).containsExactly(1.0, 6.0);
    }

    @Test
    @DisplayName("Should keep labels inside the input span and respect the row bound")
    void shouldStayInsideSpan() {
        List<LocalDateTime> index = new ArrayList<>();
        double[] values = new double[50];
        LocalDateTime time = LocalDateTime.of(2024, 1, 1, 0, 0, 7);
        for (int i = 0; i < values.length; i++) {
            index.add(time);
            values[i] = i;
            time = time.plusSeconds(1 + (i % 3));
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("v", values);
        Dataset data = new Dataset(index, columns, Map.of());
        ResamplePeriod period = ResamplePeriod.parse("7S");

        Dataset out = Resampler.resample(data, period, Aggregator.FIRST);

        LocalDateTime first = index.get(0);
        LocalDateTime last = index.get(index.size() - 1);
        long span = Duration.between(first, last).toMillis();
        assertThat(out.rowCount()).isLessThanOrEqualTo((int) Math.ceil((double) span / period.toMillis()));
        assertThat(out.getIndex()).allSatisfy(label -> assertThat(label).isBetween(first, last));
    }

    @Test
    @DisplayName("Should open one extra bucket when the span is an exact multiple of the period")
    void shouldOpenExtraBucketOnExactMultiple() {
        // 15 samples one second apart: a span of 14 s, exactly two 7 s periods
        double[] values = new double[15];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        Dataset data = dataset(values);
        ResamplePeriod period = ResamplePeriod.parse("7S");

        Dataset out = Resampler.resample(data, period, Aggregator.MEAN);

        long span = Duration.between(t(0), t(14)).toMillis();
        int periods = (int) Math.ceil((double) span / period.toMillis());
        assertThat(out.rowCount()).isEqualTo(periods + 1);
        assertThat(out.getIndex()).containsExactly(t(0), t(7), t(14));
        assertThat(out.getValues("v")).containsExactly(3.0, 10.0, 14.0);
    }

    @Test
    @DisplayName("Should report invalid settings and leave the caller's data usable")
    void shouldFailGracefully() {
        Dataset data = dataset(1, 2, 3);

        Outcome<Dataset> badAggregator = Resampler.tryResample(data, "1S", "mode");
        Outcome<Dataset> badPeriod = Resampler.tryResample(data, "every now and then", "mean");

        assertThat(badAggregator.isSuccess()).isFalse();
        assertThat(badAggregator.getError().getKind()).isEqualTo(ErrorKind.CONFIGURATION);
        assertThat(badAggregator.getError().getMessage()).contains("keeping raw data");
        assertThat(badPeriod.isSuccess()).isFalse();
        assertThat(Resampler.tryResample(data, "1S", "mean").getValue().rowCount()).isEqualTo(3);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Dataset dataset(double... values) {
        List<LocalDateTime> index = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            index.add(t(i));
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("v", values);
        return new Dataset(index, columns, Map.of());
    }

    private static LocalDateTime t(int seconds) {
        return LocalDateTime.of(2024, 1, 1, 0, 0).plusSeconds(seconds);
    }
}
