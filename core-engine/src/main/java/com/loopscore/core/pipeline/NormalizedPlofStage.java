package com.loopscore.core.pipeline;

/**
 * {@code nplof = extent × sqrt(cluster_ev_plof_sq)}, the cluster scale used to
 * turn PLOF into a probability.
 *
 * @since 1.0.0
 */
public class NormalizedPlofStage implements PipelineStage {

    private final double extent;

    /**
     * @param extent statistical extent in (0, 1]
     */
    public NormalizedPlofStage(double extent) {
        this.extent = extent;
    }

    @Override
    public void apply(StatisticsTable table) {
        double[] expected = table.column(StatisticsField.CLUSTER_EV_PLOF_SQ);

        double[] nplof = new double[table.size()];
        for (int row = 0; row < nplof.length; row++) {
            nplof[row] = extent * Math.sqrt(expected[row]);
        }
        table.populate(StatisticsField.NPLOF, nplof);
    }

    @Override
    public String getStageName() {
        return "nplof";
    }
}
