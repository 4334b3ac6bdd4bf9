package com.loopscore.core.pipeline;

import org.apache.commons.math3.special.Erf;

/**
 * Final score: {@code loop_score = max(0, erf(plof / (nplof × √2)))}.
 *
 * <p>
 * Points denser than their cluster (negative PLOF) score 0. NaN inputs give a
 * NaN score.
 * </p>
 *
 * <p>
 * A cluster whose members all share the same density has PLOF 0 everywhere
 * and therefore nPLOF 0. Those rows score 0: the cluster holds no outlier
 * evidence, and {@code 0 / 0} is not treated as a missing value.
 * </p>
 *
 * @since 1.0.0
 */
public class LocalOutlierProbabilityStage implements PipelineStage {

    private static final double SQRT_2 = Math.sqrt(2.0);

    @Override
    public void apply(StatisticsTable table) {
        double[] plof = table.column(StatisticsField.PLOF);
        double[] nplof = table.column(StatisticsField.NPLOF);

        double[] scores = new double[table.size()];
        for (int row = 0; row < scores.length; row++) {
            scores[row] = probability(plof[row], nplof[row]);
        }
        table.populate(StatisticsField.LOOP_SCORE, scores);
    }

    /**
     * Score of a single observation.
     *
     * @param plof  probabilistic local outlier factor
     * @param nplof normalized expected PLOF of its cluster
     * @return probability in [0, 1], or NaN
     */
    static double probability(double plof, double nplof) {
        if (Double.isNaN(plof) || Double.isNaN(nplof)) {
            return Double.NaN;
        }
        if (plof == 0.0 && nplof == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Erf.erf(plof / (nplof * SQRT_2)));
    }

    @Override
    public String getStageName() {
        return "loop-score";
    }
}
