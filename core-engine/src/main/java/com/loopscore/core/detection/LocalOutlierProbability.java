package com.loopscore.core.detection;

import com.loopscore.core.config.LoopConfig;
import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;
import com.loopscore.core.pipeline.ProbabilityPipeline;
import com.loopscore.core.pipeline.StatisticsField;
import com.loopscore.core.pipeline.StatisticsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Local Outlier Probability (LoOP) detector.
 *
 * <p>
 * Scores each observation with the probability, in [0, 1], that it is a
 * density-based outlier with respect to its {@code neighbors} nearest
 * neighbours inside its cluster. Based on Kriegel, Kröger, Schubert and Zimek,
 * <i>LoOP: Local Outlier Probabilities</i> (CIKM 2009).
 * </p>
 *
 * <pre>
 * LocalOutlierProbability loop = new LocalOutlierProbability(new LoopConfig(0.997, 10));
 * double[] scores = loop.fit(Dataset.of(rows));
 * </pre>
 *
 * <h3>Errors</h3>
 * <ul>
 * <li>{@link com.loopscore.core.config.ConfigurationException}: invalid
 * configuration, or a cluster not larger than {@code neighbors}; thrown
 * before any distance is computed</li>
 * <li>{@link com.loopscore.core.pipeline.DegenerateClusterException}: a
 * cluster without dispersion; no scores are returned</li>
 * </ul>
 * <p>
 * Missing values (NaN) are not errors. The affected rows may score NaN while
 * all other rows are scored normally.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The detector is <strong>stateless</strong> apart from its immutable
 * configuration; every call builds and discards its own working table, so an
 * instance may be shared between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class LocalOutlierProbability implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LocalOutlierProbability.class);

    private final LoopConfig config;
    private final ProbabilityPipeline pipeline;

    /**
     * Create a detector with default settings (extent 0.997, 10 neighbours).
     */
    public LocalOutlierProbability() {
        this(new LoopConfig());
    }

    /**
     * @param config detector configuration; must not be {@code null}
     * @throws NullPointerException if {@code config} is {@code null}
     * @throws com.loopscore.core.config.ConfigurationException if
     *         {@code extent} or {@code neighbors} is out of range
     */
    public LocalOutlierProbability(LoopConfig config) {
        Objects.requireNonNull(config, "LoopConfig must not be null");
        config.validate();
        this.config = config.copy();
        this.pipeline = ProbabilityPipeline.standard(this.config);
    }

    @Override
    public double[] fit(Dataset dataset) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        return fit(dataset, ClusterAssignment.single(dataset.size()));
    }

    @Override
    public double[] fit(Dataset dataset, ClusterAssignment assignment) {
        return fitWithStatistics(dataset, assignment).column(StatisticsField.LOOP_SCORE);
    }

    /**
     * Score a dataset and return the complete working table, including the
     * intermediate columns and per-cluster aggregates.
     *
     * @param dataset    observations to score; must not be {@code null}
     * @param assignment cluster of every observation; must not be {@code null}
     * @return fully populated statistics table
     */
    public StatisticsTable fitWithStatistics(Dataset dataset, ClusterAssignment assignment) {
        InputValidator.validate(dataset, assignment, config);

        StatisticsTable table = pipeline.run(dataset, assignment);
        LOG.debug("Scored {} observation(s) in {} cluster(s) with {}",
                table.size(), table.getClusters().size(), config);
        return table;
    }

    /**
     * @return a copy of the configuration this detector uses
     */
    public LoopConfig getConfig() {
        return config.copy();
    }
}
