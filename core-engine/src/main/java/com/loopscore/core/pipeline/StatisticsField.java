package com.loopscore.core.pipeline;

/**
 * Per-observation columns of a {@link StatisticsTable}, in the order the
 * pipeline fills them.
 *
 * @since 1.0.0
 */
public enum StatisticsField {

    /** Mean distance to the {@code neighbors} nearest cluster members. */
    CONTEXT_DISTANCE("context_distance"),

    /** Distance to the single nearest cluster member; diagnostic only. */
    CLOSEST_NEIGHBOR_DISTANCE("closest_neighbor_distance"),

    /** Sum of squared context distances of the cluster (broadcast). */
    CLUSTER_SSD("cluster_ssd"),

    STANDARD_DISTANCE("standard_distance"),

    PROB_SET_DISTANCE("prob_set_distance"),

    /** Cluster mean of the probabilistic set distance (broadcast). */
    CLUSTER_EV_PROB_SET_DISTANCE("cluster_ev_prob_set_distance"),

    /** Probabilistic local outlier factor. */
    PLOF("plof"),

    /** Cluster mean of squared PLOF (broadcast). */
    CLUSTER_EV_PLOF_SQ("cluster_ev_plof_sq"),

    /** Normalized expected PLOF, the cluster scale of PLOF. */
    NPLOF("nplof"),

    /** Local Outlier Probability, the final score. */
    LOOP_SCORE("loop_score");

    private final String columnName;

    StatisticsField(String columnName) {
        this.columnName = columnName;
    }

    /**
     * @return snake_case column name used in diagnostics and exports
     */
    public String getColumnName() {
        return columnName;
    }
}
