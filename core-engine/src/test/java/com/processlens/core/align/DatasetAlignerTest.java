package com.processlens.core.align;

import com.processlens.core.model.Dataset;
import com.processlens.core.model.SeriesInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DatasetAligner}.
 */
class DatasetAlignerTest {

    @Test
    @DisplayName("Should index the merged dataset on the union of all timestamps")
    void shouldUseUnionOfTimestamps() {
        SourceFrame a = frame("a", List.of(t(0), t(4), t(8)), "a_x", 1, 2, 3);
        SourceFrame b = frame("b", List.of(t(2), t(6)), "b_y", 10, 20);

        DatasetAligner.MergeResult result = DatasetAligner.merge(Dataset.empty(), List.of(a, b));

        TreeSet<LocalDateTime> expected = new TreeSet<>(a.getTimes());
        expected.addAll(b.getTimes());
        assertThat(result.getDataset().getIndex()).containsExactlyElementsOf(expected);
        assertThat(result.getDataset().getValues("a_x")).containsExactly(1, Double.NaN, 2, Double.NaN, 3);
        assertThat(result.getDataset().getValues("b_y")).containsExactly(Double.NaN, 10, Double.NaN, 20, Double.NaN);
    }

    @Test
    @DisplayName("Should keep the first source's column on name collision")
    void shouldKeepFirstOnCollision() {
        SourceFrame first = frame("s", List.of(t(0), t(1)), "s_v", 1, 2);
        SourceFrame later = frame("s", List.of(t(1), t(2)), "s_v", 100, 200);

        DatasetAligner.MergeResult result = DatasetAligner.merge(Dataset.empty(), List.of(first, later));

        assertThat(result.getDiscarded()).containsExactly("s_v");
        assertThat(result.getDataset().getSeriesNames()).containsExactly("s_v");
        assertThat(result.getDataset().getValues("s_v")).containsExactly(1, 2, Double.NaN);
    }

    @Test
    @DisplayName("Should merge into an existing snapshot and keep its columns first")
    void shouldMergeIntoBase() {
        Dataset base = DatasetAligner.merge(Dataset.empty(),
                List.of(frame("a", List.of(t(0)), "a_x", 5))).getDataset();

        Dataset merged = DatasetAligner.merge(base,
                List.of(frame("b", List.of(t(3)), "b_y", 7))).getDataset();

        assertThat(merged.getSeriesNames()).containsExactly("a_x", "b_y");
        assertThat(merged.getIndex()).containsExactly(t(0), t(3));
        assertThat(base.getIndex()).containsExactly(t(0));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static SourceFrame frame(String source, List<LocalDateTime> times, String name, double... values) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(name, values);
        return new SourceFrame(source, times, columns, Map.of(name, new SeriesInfo(name, name, source, null)));
    }

    private static LocalDateTime t(int seconds) {
        return LocalDateTime.of(2024, 1, 1, 0, 0).plusSeconds(seconds);
    }
}
