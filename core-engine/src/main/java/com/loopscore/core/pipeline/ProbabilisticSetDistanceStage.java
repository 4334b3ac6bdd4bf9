package com.loopscore.core.pipeline;

/**
 * {@code prob_set_distance = 1 / (extent × standard_distance)}.
 *
 * @since 1.0.0
 */
public class ProbabilisticSetDistanceStage implements PipelineStage {

    private final double extent;

    /**
     * @param extent statistical extent in (0, 1]
     */
    public ProbabilisticSetDistanceStage(double extent) {
        this.extent = extent;
    }

    @Override
    public void apply(StatisticsTable table) {
        double[] standard = table.column(StatisticsField.STANDARD_DISTANCE);

        double[] setDistance = new double[table.size()];
        for (int row = 0; row < setDistance.length; row++) {
            setDistance[row] = 1.0 / (extent * standard[row]);
        }
        table.populate(StatisticsField.PROB_SET_DISTANCE, setDistance);
    }

    @Override
    public String getStageName() {
        return "prob-set-distance";
    }
}
