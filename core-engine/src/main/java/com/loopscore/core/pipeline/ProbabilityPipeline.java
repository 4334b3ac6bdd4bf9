package com.loopscore.core.pipeline;

import com.loopscore.core.config.LoopConfig;
import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs an ordered list of {@link PipelineStage}s over a fresh
 * {@link StatisticsTable}.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   neighbour distances   → context_distance, closest_neighbor_distance
 *   cluster SSD           → cluster_ssd
 *   standard distance     → standard_distance
 *   prob. set distance    → prob_set_distance
 *   expected set distance → cluster_ev_prob_set_distance
 *   PLOF                  → plof
 *   expected squared PLOF → cluster_ev_plof_sq
 *   nPLOF                 → nplof
 *   outlier probability   → loop_score
 * </pre>
 *
 * <p>
 * Linear, single pass, no retries. A {@link DegenerateClusterException} from
 * any stage aborts the run and the partially filled table is discarded.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProbabilityPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ProbabilityPipeline.class);

    private final List<PipelineStage> stages;

    /**
     * @param stages stages in execution order; must not be {@code null}
     */
    public ProbabilityPipeline(List<PipelineStage> stages) {
        Objects.requireNonNull(stages, "Stages must not be null");
        this.stages = List.copyOf(stages);
    }

    /**
     * Create the standard nine-stage LoOP pipeline.
     *
     * @param config validated configuration; must not be {@code null}
     * @return pipeline producing {@link StatisticsField#LOOP_SCORE}
     */
    public static ProbabilityPipeline standard(LoopConfig config) {
        Objects.requireNonNull(config, "LoopConfig must not be null");
        return new ProbabilityPipeline(List.of(
                new NeighborDistanceStage(config.getNeighbors(), config.isParallelClusters()),
                new ClusterSsdStage(),
                new StandardDistanceStage(),
                new ProbabilisticSetDistanceStage(config.getExtent()),
                new ExpectedSetDistanceStage(),
                new PlofStage(),
                new ExpectedSquaredPlofStage(),
                new NormalizedPlofStage(config.getExtent()),
                new LocalOutlierProbabilityStage()));
    }

    /**
     * Run every stage over the given inputs.
     *
     * @param dataset    observations; must not be {@code null}
     * @param assignment cluster of every observation; must not be {@code null}
     * @return the fully populated table
     * @throws DegenerateClusterException if a cluster has no dispersion
     */
    public StatisticsTable run(Dataset dataset, ClusterAssignment assignment) {
        StatisticsTable table = new StatisticsTable(dataset, assignment);
        LOG.debug("Running {} stage(s) over {} observation(s) in {} cluster(s)",
                stages.size(), table.size(), table.getClusters().size());

        for (PipelineStage stage : stages) {
            long start = System.nanoTime();
            stage.apply(table);
            LOG.debug("Stage [{}] finished in {} µs", stage.getStageName(),
                    (System.nanoTime() - start) / 1_000);
        }
        return table;
    }

    /**
     * @return unmodifiable list of stages in execution order
     */
    public List<PipelineStage> getStages() {
        return stages;
    }
}
