package com.loopscore.core.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Raised when a cluster has no usable dispersion: all neighbour distances are
 * zero, or a cluster's sum of squared distances is exactly zero.
 *
 * <p>
 * Every later stage divides by these quantities, so the whole run is aborted
 * and no partial scores are returned.
 * </p>
 *
 * @since 1.0.0
 */
public class DegenerateClusterException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final StatisticsField field;
    private final List<Object> clusterLabels;

    /**
     * @param field         column that was being computed
     * @param clusterLabels labels of the affected clusters
     * @param message       description of the problem
     */
    public DegenerateClusterException(StatisticsField field, List<Object> clusterLabels, String message) {
        super(message + " [field=" + Objects.requireNonNull(field, "field must not be null").getColumnName()
                + ", clusters=" + clusterLabels + "]");
        this.field = field;
        this.clusterLabels = List.copyOf(clusterLabels);
    }

    /**
     * @return column being computed when the degeneracy was detected
     */
    public StatisticsField getField() {
        return field;
    }

    /**
     * @return labels of the clusters concerned
     */
    public List<Object> getClusterLabels() {
        return clusterLabels;
    }
}
