package com.processlens.core.identification;

import com.processlens.core.model.FittedStepModel;
import com.processlens.core.model.TuningRecommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TuningHeuristic}.
 */
class TuningHeuristicTest {

    @Test
    @DisplayName("Should derive L, Kp, Ti and Td for K=5, tau=10")
    void shouldDeriveTuning() {
        TuningRecommendation t = TuningHeuristic.recommend(new FittedStepModel(5, 10, 2, 1.0));

        assertThat(t.getDeadTime()).isCloseTo(1.0, within(1e-12));
        assertThat(t.getIntegralTime()).isCloseTo(2.0, within(1e-12));
        assertThat(t.getDerivativeTime()).isCloseTo(0.5, within(1e-12));
        assertThat(t.getProportionalGain()).isCloseTo(1.2 * 10 / (5 * 1.0), within(1e-6));
    }

    @Test
    @DisplayName("Should use the gain magnitude for negative gains")
    void shouldUseGainMagnitude() {
        assertThat(TuningHeuristic.recommend(-5, 10).getProportionalGain())
                .isEqualTo(TuningHeuristic.recommend(5, 10).getProportionalGain());
    }

    @Test
    @DisplayName("Should floor a near-zero gain instead of dividing by zero")
    void shouldFloorGain() {
        TuningRecommendation t = TuningHeuristic.recommend(0.0, 10);

        assertThat(t.getProportionalGain()).isFinite().isPositive();
    }

    @Test
    @DisplayName("Should never produce a negative dead time")
    void shouldClampDeadTime() {
        TuningRecommendation t = TuningHeuristic.recommend(2, -3);

        assertThat(t.getDeadTime()).isZero();
        assertThat(t.getIntegralTime()).isZero();
    }
}
