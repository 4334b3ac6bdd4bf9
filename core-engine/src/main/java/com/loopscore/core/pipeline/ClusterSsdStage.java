package com.loopscore.core.pipeline;

import java.util.List;

/**
 * Sums the squared context distances of every cluster into
 * {@link StatisticsField#CLUSTER_SSD}.
 *
 * <p>
 * A cluster whose sum is exactly zero has no dispersion to divide by and
 * aborts the run with a {@link DegenerateClusterException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterSsdStage extends ClusterAggregateStage {

    public ClusterSsdStage() {
        super(StatisticsField.CONTEXT_DISTANCE, StatisticsField.CLUSTER_SSD);
    }

    @Override
    protected double aggregate(double[] values) {
        return sumOfSquares(values);
    }

    @Override
    protected void record(ClusterStatistics cluster, double aggregate) {
        if (aggregate == 0.0) {
            throw new DegenerateClusterException(StatisticsField.CLUSTER_SSD,
                    List.of(cluster.getLabel()),
                    "Sum of squared distances of cluster " + cluster.getLabel() + " is zero");
        }
        cluster.setSumSquaredDistance(aggregate);
    }

    @Override
    public String getStageName() {
        return "cluster-ssd";
    }
}
