package com.loopscore.core.detection;

import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;

/**
 * Contract for batch outlier detectors.
 *
 * <p>
 * A detector scores every observation of a dataset at once. Implementations
 * keep no state between calls: scoring the same input twice gives the same
 * result, and the output is aligned with the input rows.
 * </p>
 */
public interface OutlierDetector {

    /**
     * Score a dataset treated as a single cluster.
     *
     * @param dataset observations to score
     * @return one score per observation, in input order
     */
    double[] fit(Dataset dataset);

    /**
     * Score a dataset partitioned into clusters.
     *
     * @param dataset    observations to score
     * @param assignment cluster of every observation
     * @return one score per observation, in input order
     */
    double[] fit(Dataset dataset, ClusterAssignment assignment);
}
