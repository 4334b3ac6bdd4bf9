package com.loopscore.core.detection;

import com.loopscore.core.config.ConfigurationException;
import com.loopscore.core.config.LoopConfig;
import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;
import com.loopscore.core.pipeline.DegenerateClusterException;
import com.loopscore.core.pipeline.StatisticsField;
import com.loopscore.core.pipeline.StatisticsTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LocalOutlierProbability}.
 */
class LocalOutlierProbabilityTest {

    /** Two loose clusters, each with one point away from the rest. */
    private static final double[][] REFERENCE_ROWS = {
            {0.0, 0.0}, {0.0, 1.0}, {1.0, 0.0}, {1.0, 1.0}, {3.0, 3.0},
            {10.0, 10.0}, {10.5, 10.0}, {10.0, 11.0}, {11.0, 11.5}, {14.0, 9.0}};

    private static final int[] REFERENCE_LABELS = {0, 0, 0, 0, 0, 1, 1, 1, 1, 1};

    /** 20 points drawn from N(0, 0.1²) per axis. */
    private static final double[][] TIGHT_CLUSTER = {
            {-0.0256, 0.0511}, {-0.0226, -0.0315}, {-0.093, -0.0213}, {0.1112, 0.0424},
            {0.1037, 0.0249}, {0.0395, 0.0185}, {-0.1666, 0.0855}, {0.0506, 0.0499},
            {-0.1691, -0.1744}, {-0.089, -0.0468}, {0.0305, -0.0046}, {0.0521, -0.0642},
            {0.0309, 0.0394}, {-0.0661, 0.1718}, {0.0557, 0.1197}, {-0.062, -0.074},
            {-0.0344, -0.0106}, {0.0632, 0.0248}, {-0.0447, -0.0957}, {-0.0521, 0.1221}};

    private LocalOutlierProbability detector;

    @BeforeEach
    void setUp() {
        detector = new LocalOutlierProbability(new LoopConfig(0.997, 2));
    }

    // ------------------------------------------------------------------
    // Reference reproduction
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should reproduce the reference scores for two clusters")
    void shouldReproduceClusteredReference() {
        double[] scores = detector.fit(Dataset.of(REFERENCE_ROWS), ClusterAssignment.of(REFERENCE_LABELS));

        assertScores(scores, 0.0, 0.0, 0.0, 0.0, 0.9551456782018998,
                0.0, 0.0, 0.0, 0.0, 0.946973242578056);
    }

    @Test
    @DisplayName("Should reproduce the reference scores without cluster labels")
    void shouldReproduceSingleClusterReference() {
        double[] scores = detector.fit(Dataset.of(REFERENCE_ROWS));

        assertScores(scores, 0.0, 0.0, 0.0, 0.0, 0.9191957992916892,
                0.0, 0.0, 0.0, 0.0, 0.9693759263615517);
    }

    @Test
    @DisplayName("A missing value should only produce NaN for its own row")
    void shouldIsolateMissingValues() {
        double[][] rows = copy(REFERENCE_ROWS);
        rows[2][0] = Double.NaN;

        double[] scores = detector.fit(Dataset.of(rows), ClusterAssignment.of(REFERENCE_LABELS));

        assertThat(scores[2]).isNaN();
        assertThat(scores[4]).isCloseTo(0.9151546762197165, within(1e-6));
        assertThat(scores[9]).isCloseTo(0.946973242578056, within(1e-6));
        for (int i = 0; i < scores.length; i++) {
            if (i != 2) {
                assertThat(scores[i]).isBetween(0.0, 1.0);
            }
        }
    }

    // ------------------------------------------------------------------
    // Properties
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should separate a far point from a tight cluster")
    void shouldSeparateDistantOutlier() {
        double[][] rows = new double[TIGHT_CLUSTER.length + 1][];
        System.arraycopy(copy(TIGHT_CLUSTER), 0, rows, 0, TIGHT_CLUSTER.length);
        rows[TIGHT_CLUSTER.length] = new double[]{5.0, 5.0};

        double[] scores = new LocalOutlierProbability(new LoopConfig(0.997, 5)).fit(Dataset.of(rows));

        assertThat(scores[TIGHT_CLUSTER.length]).isGreaterThan(0.9);
        for (int i = 0; i < TIGHT_CLUSTER.length; i++) {
            assertThat(scores[i]).as("inlier %d", i).isLessThan(0.3);
        }
    }

    @Test
    @DisplayName("Scores should have one entry per row and lie in [0, 1]")
    void shouldReturnProbabilities() {
        Random random = new Random(11);
        double[][] rows = new double[120][4];
        for (double[] row : rows) {
            for (int k = 0; k < row.length; k++) {
                row[k] = random.nextGaussian() * (1 + k);
            }
        }

        double[] scores = new LocalOutlierProbability(new LoopConfig(0.95, 10)).fit(Dataset.of(rows));

        assertThat(scores).hasSize(120);
        for (double score : scores) {
            assertThat(score).isBetween(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("Permuting the rows should permute the scores")
    void shouldBePermutationEquivariant() {
        int[] permutation = {7, 2, 9, 0, 4, 1, 8, 3, 6, 5};
        double[][] permutedRows = new double[permutation.length][];
        int[] permutedLabels = new int[permutation.length];
        for (int i = 0; i < permutation.length; i++) {
            permutedRows[i] = REFERENCE_ROWS[permutation[i]].clone();
            permutedLabels[i] = REFERENCE_LABELS[permutation[i]];
        }

        double[] original = detector.fit(Dataset.of(REFERENCE_ROWS), ClusterAssignment.of(REFERENCE_LABELS));
        double[] permuted = detector.fit(Dataset.of(permutedRows), ClusterAssignment.of(permutedLabels));

        for (int i = 0; i < permutation.length; i++) {
            assertThat(permuted[i]).isCloseTo(original[permutation[i]], within(1e-12));
        }
    }

    @Test
    @DisplayName("No labels should equal one explicit cluster")
    void shouldDefaultToSingleCluster() {
        Dataset dataset = Dataset.of(REFERENCE_ROWS);

        double[] implicit = detector.fit(dataset);
        double[] explicit = detector.fit(dataset, ClusterAssignment.of(new int[REFERENCE_ROWS.length]));

        assertThat(implicit).containsExactly(explicit);
    }

    @Test
    @DisplayName("Categorical labels should score like the equivalent integers")
    void shouldAcceptCategoricalLabels() {
        Dataset dataset = Dataset.of(REFERENCE_ROWS);
        List<String> labels = List.of("a", "a", "a", "a", "a", "b", "b", "b", "b", "b");

        assertThat(detector.fit(dataset, ClusterAssignment.of(labels)))
                .containsExactly(detector.fit(dataset, ClusterAssignment.of(REFERENCE_LABELS)));
    }

    @Test
    @DisplayName("Repeated calls should not influence each other")
    void shouldBeStateless() {
        Dataset dataset = Dataset.of(REFERENCE_ROWS);

        double[] first = detector.fit(dataset);
        detector.fit(Dataset.of(TIGHT_CLUSTER));
        double[] second = detector.fit(dataset);

        assertThat(second).containsExactly(first);
    }

    @Test
    @DisplayName("Parallel cluster processing should not change the scores")
    void shouldMatchSequentialWhenParallel() {
        LoopConfig config = new LoopConfig(0.997, 2);
        config.setParallelClusters(true);
        Dataset dataset = Dataset.of(REFERENCE_ROWS);
        ClusterAssignment assignment = ClusterAssignment.of(REFERENCE_LABELS);

        assertThat(new LocalOutlierProbability(config).fit(dataset, assignment))
                .containsExactly(detector.fit(dataset, assignment));
    }

    @Test
    @DisplayName("Statistics table should expose intermediate columns")
    void shouldExposeStatistics() {
        StatisticsTable table = detector.fitWithStatistics(Dataset.of(REFERENCE_ROWS),
                ClusterAssignment.of(REFERENCE_LABELS));

        for (StatisticsField field : StatisticsField.values()) {
            assertThat(table.isPopulated(field)).as(field.getColumnName()).isTrue();
        }
        assertThat(table.get(StatisticsField.CLOSEST_NEIGHBOR_DISTANCE, 4))
                .isCloseTo(2.8284271247461903, within(1e-12));
        assertThat(table.getClusters()).hasSize(2);
    }

    @Test
    @DisplayName("Points of equal local density should all score zero")
    void shouldScoreUniformGridAsInliers() {
        double[][] square = {{0.0, 0.0}, {0.0, 1.0}, {1.0, 0.0}, {1.0, 1.0}};
        double[][] grid = new double[9][];
        for (int i = 0; i < 9; i++) {
            grid[i] = new double[]{i / 3, i % 3};
        }

        assertThat(detector.fit(Dataset.of(square))).containsOnly(0.0);
        assertThat(detector.fit(Dataset.of(grid))).containsOnly(0.0);
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Identical points should be reported as a degenerate cluster")
    void shouldRejectIdenticalPoints() {
        double[][] rows = new double[8][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new double[]{2.5, -1.0};
        }

        assertThatThrownBy(() -> detector.fit(Dataset.of(rows)))
                .isInstanceOf(DegenerateClusterException.class)
                .hasMessageContaining("all zero");
    }

    @Test
    @DisplayName("Invalid configuration should fail at construction")
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new LocalOutlierProbability(new LoopConfig(0.997, 0)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("neighbors");
        assertThatThrownBy(() -> new LocalOutlierProbability(new LoopConfig(1.5, 10)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("extent");
    }

    @Test
    @DisplayName("Neighbours not smaller than a cluster should fail before scoring")
    void shouldRejectTooFewClusterMembers() {
        int[] labels = {0, 0, 0, 0, 0, 0, 0, 0, 1, 1};

        assertThatThrownBy(() -> detector.fit(Dataset.of(REFERENCE_ROWS), ClusterAssignment.of(labels)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cluster 1 has 2 member(s)");
    }

    @Test
    @DisplayName("Later changes to the configuration bean should not affect the detector")
    void shouldCopyConfiguration() {
        LoopConfig config = new LoopConfig(0.997, 2);
        LocalOutlierProbability loop = new LocalOutlierProbability(config);

        config.setNeighbors(50);

        assertThat(loop.getConfig().getNeighbors()).isEqualTo(2);
        assertThat(loop.fit(Dataset.of(REFERENCE_ROWS))).hasSize(REFERENCE_ROWS.length);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void assertScores(double[] actual, double... expected) {
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i]).as("score[%d]", i).isCloseTo(expected[i], within(1e-6));
        }
    }

    private static double[][] copy(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
