package com.loopscore.core.pipeline;

/**
 * One step of the probability pipeline.
 *
 * <p>
 * A stage reads columns that earlier stages populated, together with the
 * configuration it was created with, and populates the column(s) it
 * produces. Stages hold no state between runs.
 * </p>
 */
public interface PipelineStage {

    /**
     * Compute this stage's column(s) and store them in {@code table}.
     *
     * @param table working table of the current run
     * @throws DegenerateClusterException if the stage detects a cluster without
     *                                    dispersion
     */
    void apply(StatisticsTable table);

    /**
     * Return a short name for logging.
     *
     * @return stage name
     */
    String getStageName();
}
