package com.processlens.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RobustStatistics}.
 */
class RobustStatisticsTest {

    @Test
    @DisplayName("Should truncate the rolling window at the edges")
    void shouldRollWithTruncatedEdges() {
        double[] out = RobustStatistics.rollingMedian(new double[] { 0, 10, 0, 0, 4 }, 3);

        assertThat(out).containsExactly(5, 0, 0, 0, 2);
    }

    @Test
    @DisplayName("Should suppress a single-sample spike")
    void shouldSuppressSpike() {
        double[] out = RobustStatistics.rollingMedian(new double[] { 1, 1, 9, 1, 1 }, 3);

        assertThat(out).containsExactly(1, 1, 1, 1, 1);
    }

    @Test
    @DisplayName("Should compute the median absolute deviation")
    void shouldComputeMad() {
        assertThat(RobustStatistics.medianAbsoluteDeviation(new double[] { 1, 1, 2, 2, 4, 6, 9 }))
                .isCloseTo(1.0, within(1e-12));
        assertThat(RobustStatistics.medianAbsoluteDeviation(new double[] { 3, 3, 3 })).isZero();
    }

    @Test
    @DisplayName("Should compute first differences")
    void shouldDifference() {
        assertThat(RobustStatistics.differences(new double[] { 1, 4, 2 })).containsExactly(3, -2);
        assertThat(RobustStatistics.differences(new double[] { 1 })).isEmpty();
    }
}
