package com.loopscore.core.pipeline;

/**
 * Cluster mean of the probabilistic set distance, broadcast into
 * {@link StatisticsField#CLUSTER_EV_PROB_SET_DISTANCE}.
 *
 * @since 1.0.0
 */
public class ExpectedSetDistanceStage extends ClusterAggregateStage {

    public ExpectedSetDistanceStage() {
        super(StatisticsField.PROB_SET_DISTANCE, StatisticsField.CLUSTER_EV_PROB_SET_DISTANCE);
    }

    @Override
    protected double aggregate(double[] values) {
        return mean(values);
    }

    @Override
    protected void record(ClusterStatistics cluster, double aggregate) {
        cluster.setExpectedProbSetDistance(aggregate);
    }

    @Override
    public String getStageName() {
        return "ev-prob-set-distance";
    }
}
