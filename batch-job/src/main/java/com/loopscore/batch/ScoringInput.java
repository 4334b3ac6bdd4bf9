package com.loopscore.batch;

import com.loopscore.core.config.ConfigurationException;
import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Observations converted into the inputs of the LoOP detector.
 *
 * <p>
 * Features are taken from the configured fields, or, when none are
 * configured, from every numeric field of the first observation (excluding
 * the cluster and id fields) in document order. An absent or non-numeric
 * feature becomes NaN.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringInput {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringInput.class);

    private final List<String> featureFields;
    private final Dataset dataset;
    private final ClusterAssignment assignment;
    private final List<String> ids;
    private final List<String> clusterLabels;

    private ScoringInput(List<String> featureFields, Dataset dataset, ClusterAssignment assignment,
                         List<String> ids, List<String> clusterLabels) {
        this.featureFields = featureFields;
        this.dataset = dataset;
        this.assignment = assignment;
        this.ids = ids;
        this.clusterLabels = clusterLabels;
    }

    /**
     * Build the detector inputs.
     *
     * @param observations parsed input records; must not be empty
     * @param config       job configuration
     * @return the converted inputs
     * @throws IllegalArgumentException if there are no observations or no features
     * @throws ConfigurationException   if an observation has no cluster label
     */
    public static ScoringInput from(List<Observation> observations, JobConfig config) {
        Objects.requireNonNull(observations, "Observations must not be null");
        Objects.requireNonNull(config, "JobConfig must not be null");
        if (observations.isEmpty()) {
            throw new IllegalArgumentException("No observations to score");
        }

        List<String> features = config.getFeatureFields().isEmpty()
                ? inferFeatures(observations.get(0), config)
                : config.getFeatureFields();
        if (features.isEmpty()) {
            throw new IllegalArgumentException("No numeric feature fields found in the first observation");
        }
        LOG.info("Using feature field(s): {}", features);

        double[][] rows = new double[observations.size()][features.size()];
        List<String> ids = new ArrayList<>(observations.size());
        List<String> labels = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            Observation observation = observations.get(i);
            for (int k = 0; k < features.size(); k++) {
                rows[i][k] = observation.getFeature(features.get(k));
            }
            ids.add(optionalField(observation, config.getIdField()).orElse(null));
            if (config.hasClusterField()) {
                int row = i;
                labels.add(observation.getStringField(config.getClusterField())
                        .orElseThrow(() -> new ConfigurationException("observation " + row
                                + " has no value for cluster field '" + config.getClusterField() + "'")));
            }
        }

        Dataset dataset = Dataset.of(rows);
        ClusterAssignment assignment = config.hasClusterField()
                ? ClusterAssignment.of(labels)
                : ClusterAssignment.single(rows.length);
        return new ScoringInput(List.copyOf(features), dataset, assignment,
                Collections.unmodifiableList(ids),
                config.hasClusterField() ? Collections.unmodifiableList(labels) : null);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public List<String> getFeatureFields() {
        return featureFields;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public ClusterAssignment getAssignment() {
        return assignment;
    }

    /**
     * @param row observation index
     * @return the record id, or {@code null} when no id field is configured or
     *         the record has none
     */
    public String idOf(int row) {
        return ids.get(row);
    }

    /**
     * @param row observation index
     * @return the cluster label, or {@code null} when no cluster field is
     *         configured
     */
    public String clusterOf(int row) {
        return clusterLabels == null ? null : clusterLabels.get(row);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<String> inferFeatures(Observation first, JobConfig config) {
        List<String> features = new ArrayList<>();
        for (Map.Entry<String, Object> entry : first.getFields().entrySet()) {
            String name = entry.getKey();
            if (name.equals(config.getClusterField()) || name.equals(config.getIdField())) {
                continue;
            }
            if (entry.getValue() instanceof Number) {
                features.add(name);
            }
        }
        return features;
    }

    private static Optional<String> optionalField(Observation observation, String field) {
        return field.isBlank() ? Optional.empty() : observation.getStringField(field);
    }
}
