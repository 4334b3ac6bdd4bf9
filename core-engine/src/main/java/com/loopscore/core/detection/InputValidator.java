package com.loopscore.core.detection;

import com.loopscore.core.config.ConfigurationException;
import com.loopscore.core.config.LoopConfig;
import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks the inputs of a scoring call before the pipeline touches them.
 *
 * <ul>
 * <li>configuration ranges ({@link LoopConfig#validate()})</li>
 * <li>the assignment covers exactly the dataset's rows</li>
 * <li>every cluster has more than {@code neighbors} members</li>
 * </ul>
 *
 * <p>
 * Missing values are not rejected. They are logged at WARN because the
 * affected rows may come back as NaN.
 * </p>
 *
 * @since 1.0.0
 */
public final class InputValidator {

    private static final Logger LOG = LoggerFactory.getLogger(InputValidator.class);

    private InputValidator() {
        // utility class
    }

    /**
     * Validate a scoring call.
     *
     * @param dataset    observations; must not be {@code null}
     * @param assignment cluster assignment; must not be {@code null}
     * @param config     detector configuration; must not be {@code null}
     * @throws ConfigurationException listing every violation found
     */
    public static void validate(Dataset dataset, ClusterAssignment assignment, LoopConfig config) {
        Objects.requireNonNull(dataset, "Dataset must not be null");
        Objects.requireNonNull(assignment, "ClusterAssignment must not be null");
        Objects.requireNonNull(config, "LoopConfig must not be null");

        config.validate();

        List<String> errors = new ArrayList<>();
        if (assignment.size() != dataset.size()) {
            errors.add("cluster labels must cover every observation, got " + assignment.size()
                    + " label(s) for " + dataset.size() + " observation(s)");
        }
        int smallest = assignment.smallestCluster();
        int smallestSize = assignment.clusterSize(smallest);
        if (config.getNeighbors() >= smallestSize) {
            errors.add("neighbors must be smaller than the smallest cluster, got: " + config.getNeighbors()
                    + " (cluster " + assignment.label(smallest) + " has " + smallestSize + " member(s))");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }

        if (dataset.hasMissingValues()) {
            LOG.warn("Input data contains missing values in {} of {} observation(s); "
                    + "their scores may be NaN", dataset.missingRowCount(), dataset.size());
        }
    }
}
