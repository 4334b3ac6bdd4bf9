package com.loopscore.core.pipeline;

/**
 * {@code standard_distance = sqrt(cluster_ssd / |context_distance|)}.
 *
 * <p>
 * Plain IEEE arithmetic: a zero context distance gives {@code +∞} and NaN
 * propagates. Neither is an error at this point.
 * </p>
 *
 * @since 1.0.0
 */
public class StandardDistanceStage implements PipelineStage {

    @Override
    public void apply(StatisticsTable table) {
        double[] context = table.column(StatisticsField.CONTEXT_DISTANCE);
        double[] ssd = table.column(StatisticsField.CLUSTER_SSD);

        double[] standard = new double[table.size()];
        for (int row = 0; row < standard.length; row++) {
            standard[row] = Math.sqrt(ssd[row] / Math.abs(context[row]));
        }
        table.populate(StatisticsField.STANDARD_DISTANCE, standard);
    }

    @Override
    public String getStageName() {
        return "standard-distance";
    }
}
