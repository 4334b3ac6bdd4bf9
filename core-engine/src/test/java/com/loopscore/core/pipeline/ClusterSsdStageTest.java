package com.loopscore.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClusterSsdStage}.
 */
class ClusterSsdStageTest {

    private final ClusterSsdStage stage = new ClusterSsdStage();

    @Test
    @DisplayName("Should sum squared context distances per cluster, skipping NaN")
    void shouldComputeSsdPerCluster() {
        StatisticsTable table = StageFixtures.labelled(1, 1, 1, 2);
        table.populate(StatisticsField.CONTEXT_DISTANCE, new double[]{1.0, 2.0, Double.NaN, 3.0});

        stage.apply(table);

        assertThat(table.column(StatisticsField.CLUSTER_SSD)).containsExactly(5.0, 5.0, 5.0, 9.0);
        assertThat(table.getClusters().get(0).getSumSquaredDistance()).isEqualTo(5.0);
        assertThat(table.getClusters().get(1).getSumSquaredDistance()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Should fail for a cluster whose sum is zero")
    void shouldRejectZeroSsd() {
        StatisticsTable table = StageFixtures.labelled(3, 3, 4, 4);
        table.populate(StatisticsField.CONTEXT_DISTANCE, new double[]{1.0, 1.0, 0.0, 0.0});

        assertThatThrownBy(() -> stage.apply(table))
                .isInstanceOfSatisfying(DegenerateClusterException.class, e -> {
                    assertThat(e.getField()).isEqualTo(StatisticsField.CLUSTER_SSD);
                    assertThat(e.getClusterLabels()).containsExactly(4);
                    assertThat(e.getMessage()).contains("cluster_ssd");
                });
    }

    @Test
    @DisplayName("A cluster of only missing values should count as zero dispersion")
    void shouldRejectAllMissingCluster() {
        StatisticsTable table = StageFixtures.labelled(0, 0);
        table.populate(StatisticsField.CONTEXT_DISTANCE, new double[]{Double.NaN, Double.NaN});

        assertThatThrownBy(() -> stage.apply(table)).isInstanceOf(DegenerateClusterException.class);
    }
}
