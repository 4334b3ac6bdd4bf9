package com.loopscore.batch;

import com.loopscore.core.config.LoopConfig;
import com.loopscore.core.config.LoopConfigLoader;
import com.loopscore.core.detection.LocalOutlierProbability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point of the LoOP batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON-lines file
 *     → ObservationReader → Observation
 *     → ScoringInput (features, cluster labels, ids)
 *     → LocalOutlierProbability
 *     → ScoreRecord
 *     → ScoreWriter → JSON-lines file or stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * The job is configured through environment variables ({@link JobConfig});
 * detector parameters come from YAML ({@link LoopConfigLoader}).
 * </p>
 *
 * @since 1.0.0
 */
public final class LoopScoringJob {

    private static final Logger LOG = LoggerFactory.getLogger(LoopScoringJob.class);

    private LoopScoringJob() {
        // entry point only
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting LoOP batch job with config: {}", config);

        // 2. Score and write
        List<ScoreRecord> records = run(config);
        LOG.info("LoOP batch job finished: {} record(s) written", records.size());
    }

    /**
     * Read, score and write one batch.
     *
     * @param config job configuration
     * @return the records written, in input order
     * @throws IOException if the input cannot be read or the output written
     */
    public static List<ScoreRecord> run(JobConfig config) throws IOException {
        LoopConfig loopConfig = loadLoopConfig(config);

        List<Observation> observations = new ObservationReader().read(Path.of(config.getInputPath()));
        ScoringInput input = ScoringInput.from(observations, config);

        double[] scores = new LocalOutlierProbability(loopConfig)
                .fit(input.getDataset(), input.getAssignment());
        List<ScoreRecord> records = toRecords(input, scores);
        logSummary(input, scores);

        if (config.getOutputPath().isBlank()) {
            new ScoreWriter().write(records, System.out);
        } else {
            Path target = Path.of(config.getOutputPath());
            try (OutputStream out = Files.newOutputStream(target)) {
                new ScoreWriter().write(records, out);
            }
            LOG.info("Wrote {} score(s) to {}", records.size(), target);
        }
        return records;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static LoopConfig loadLoopConfig(JobConfig config) {
        String path = config.getLoopConfigPath();
        if (!path.isBlank()) {
            return LoopConfigLoader.fromFile(path);
        }
        return LoopConfigLoader.load();
    }

    static List<ScoreRecord> toRecords(ScoringInput input, double[] scores) {
        List<ScoreRecord> records = new ArrayList<>(scores.length);
        for (int row = 0; row < scores.length; row++) {
            records.add(new ScoreRecord(row, input.idOf(row), input.clusterOf(row), scores[row]));
        }
        return records;
    }

    private static void logSummary(ScoringInput input, double[] scores) {
        int undefined = 0;
        double max = 0;
        for (double score : scores) {
            if (Double.isNaN(score)) {
                undefined++;
            } else {
                max = Math.max(max, score);
            }
        }
        LOG.info("Scored {} observation(s) in {} cluster(s): max probability={}, undefined={}",
                scores.length, input.getAssignment().clusterCount(), max, undefined);
    }
}
