package com.loopscore.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ProbabilisticSetDistanceStage}.
 */
class ProbabilisticSetDistanceStageTest {

    @Test
    @DisplayName("Should invert the extent-scaled standard distance")
    void shouldComputeSetDistance() {
        StatisticsTable table = StageFixtures.labelled(0, 0, 0, 0);
        table.populate(StatisticsField.STANDARD_DISTANCE,
                new double[]{4.0, 1.0, Double.POSITIVE_INFINITY, Double.NaN});

        new ProbabilisticSetDistanceStage(0.5).apply(table);

        double[] setDistance = table.column(StatisticsField.PROB_SET_DISTANCE);
        assertThat(setDistance[0]).isEqualTo(0.5);
        assertThat(setDistance[1]).isEqualTo(2.0);
        assertThat(setDistance[2]).isZero();
        assertThat(setDistance[3]).isNaN();
    }

    @Test
    @DisplayName("Larger dispersion should give a smaller set distance")
    void shouldDecreaseWithDispersion() {
        StatisticsTable table = StageFixtures.labelled(0, 0);
        table.populate(StatisticsField.STANDARD_DISTANCE, new double[]{1.0, 3.0});

        new ProbabilisticSetDistanceStage(0.997).apply(table);

        double[] setDistance = table.column(StatisticsField.PROB_SET_DISTANCE);
        assertThat(setDistance[0]).isGreaterThan(setDistance[1]);
    }
}
