package com.loopscore.core.pipeline;

import com.loopscore.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Computes {@link StatisticsField#CONTEXT_DISTANCE} and
 * {@link StatisticsField#CLOSEST_NEIGHBOR_DISTANCE}.
 *
 * <p>
 * For every cluster the full pairwise Euclidean distance matrix of its members
 * is built. Each member's distances to the <i>other</i> members are sorted
 * ascending (NaN last) and the first {@code neighbors} are kept: their mean is
 * the context distance and the smallest is the closest-neighbour distance.
 * Cost is quadratic in the cluster size; no spatial index is used.
 * </p>
 *
 * <h3>Parallelism</h3>
 * <p>
 * Clusters are independent and write disjoint rows, so with
 * {@code parallel = true} they are processed on the common fork-join pool.
 * The result is identical to the sequential run.
 * </p>
 *
 * @since 1.0.0
 */
public class NeighborDistanceStage implements PipelineStage {

    private static final Logger LOG = LoggerFactory.getLogger(NeighborDistanceStage.class);

    private final int neighbors;
    private final boolean parallel;

    /**
     * @param neighbors neighbourhood size; must be positive
     * @param parallel  process clusters concurrently
     */
    public NeighborDistanceStage(int neighbors, boolean parallel) {
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be >= 1, got: " + neighbors);
        }
        this.neighbors = neighbors;
        this.parallel = parallel;
    }

    @Override
    public void apply(StatisticsTable table) {
        int n = table.size();
        double[] context = new double[n];
        double[] closest = new double[n];
        Arrays.fill(context, Double.NaN);
        Arrays.fill(closest, Double.NaN);

        IntStream clusterIndices = IntStream.range(0, table.getClusters().size());
        if (parallel) {
            clusterIndices = clusterIndices.parallel();
        }
        clusterIndices.forEach(c -> computeCluster(table.getDataset(), table.getClusters().get(c),
                context, closest));

        if (allZero(context)) {
            throw new DegenerateClusterException(StatisticsField.CONTEXT_DISTANCE,
                    table.getAssignment().labels(),
                    "Neighborhood distances are all zero; the data contains only duplicate points "
                            + "or neighbors=" + neighbors + " is too small");
        }

        table.populate(StatisticsField.CONTEXT_DISTANCE, context);
        table.populate(StatisticsField.CLOSEST_NEIGHBOR_DISTANCE, closest);
    }

    @Override
    public String getStageName() {
        return "neighbor-distance";
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void computeCluster(Dataset dataset, ClusterStatistics cluster,
                                double[] context, double[] closest) {
        int m = cluster.size();
        if (m <= neighbors) {
            throw new IllegalStateException("Cluster " + cluster.getLabel() + " has " + m
                    + " members, needs more than neighbors=" + neighbors);
        }

        double[][] distances = new double[m][m];
        for (int i = 0; i < m; i++) {
            for (int j = i + 1; j < m; j++) {
                double d = dataset.distance(cluster.member(i), cluster.member(j));
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }

        double[] others = new double[m - 1];
        for (int i = 0; i < m; i++) {
            int k = 0;
            for (int j = 0; j < m; j++) {
                if (j != i) {
                    others[k++] = distances[i][j];
                }
            }
            Arrays.sort(others);

            double sum = 0;
            for (int j = 0; j < neighbors; j++) {
                sum += others[j];
            }
            int row = cluster.member(i);
            context[row] = sum / neighbors;
            closest[row] = others[0];
        }
        LOG.trace("Cluster [{}]: neighbour distances computed for {} members", cluster.getLabel(), m);
    }

    private static boolean allZero(double[] values) {
        for (double v : values) {
            // NaN counts as non-zero
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }
}
