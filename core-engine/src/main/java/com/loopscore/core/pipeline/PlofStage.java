package com.loopscore.core.pipeline;

/**
 * Probabilistic local outlier factor:
 * {@code plof = prob_set_distance / cluster_ev_prob_set_distance − 1}.
 *
 * <p>
 * Zero when a point's density matches its cluster, positive when it is
 * sparser, negative when it is denser.
 * </p>
 *
 * @since 1.0.0
 */
public class PlofStage implements PipelineStage {

    @Override
    public void apply(StatisticsTable table) {
        double[] setDistance = table.column(StatisticsField.PROB_SET_DISTANCE);
        double[] expected = table.column(StatisticsField.CLUSTER_EV_PROB_SET_DISTANCE);

        double[] plof = new double[table.size()];
        for (int row = 0; row < plof.length; row++) {
            plof[row] = setDistance[row] / expected[row] - 1.0;
        }
        table.populate(StatisticsField.PLOF, plof);
    }

    @Override
    public String getStageName() {
        return "plof";
    }
}
