package com.loopscore.core.pipeline;

/**
 * Cluster mean of squared PLOF, broadcast into
 * {@link StatisticsField#CLUSTER_EV_PLOF_SQ}.
 *
 * <p>
 * This is the second moment about zero, not a variance about the mean.
 * </p>
 *
 * @since 1.0.0
 */
public class ExpectedSquaredPlofStage extends ClusterAggregateStage {

    public ExpectedSquaredPlofStage() {
        super(StatisticsField.PLOF, StatisticsField.CLUSTER_EV_PLOF_SQ);
    }

    @Override
    protected double aggregate(double[] values) {
        return values.length == 0 ? Double.NaN : sumOfSquares(values) / values.length;
    }

    @Override
    protected void record(ClusterStatistics cluster, double aggregate) {
        cluster.setExpectedPlofSquared(aggregate);
    }

    @Override
    public String getStageName() {
        return "ev-plof-squared";
    }
}
