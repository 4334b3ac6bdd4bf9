package com.loopscore.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of the Local Outlier Probability computation.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * extent: 0.997
 * neighbors: 10
 * parallelClusters: false
 * </pre>
 *
 * <ul>
 * <li>{@code extent}: statistical extent in (0, 1]; roughly how many standard
 * deviations count as "normal"</li>
 * <li>{@code neighbors}: neighbourhood size per observation; must be positive
 * and smaller than the smallest cluster</li>
 * <li>{@code parallelClusters}: compute neighbour distances of different
 * clusters concurrently; the result does not change</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. The
 * cluster-size constraint on {@code neighbors} depends on the input and is
 * checked by the detector before scoring.
 * </p>
 *
 * @since 1.0.0
 */
public class LoopConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_EXTENT = 0.997;
    public static final int DEFAULT_NEIGHBORS = 10;

    private double extent = DEFAULT_EXTENT;
    private int neighbors = DEFAULT_NEIGHBORS;
    private boolean parallelClusters;

    public LoopConfig() {
    }

    public LoopConfig(double extent, int neighbors) {
        this.extent = extent;
        this.neighbors = neighbors;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that {@code extent} and {@code neighbors} are within range.
     *
     * @throws ConfigurationException listing every invalid parameter
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        // Negated so that NaN is rejected too.
        if (!(extent > 0.0 && extent <= 1.0)) {
            errors.add("extent must be in (0, 1], got: " + extent);
        }
        if (neighbors <= 0) {
            errors.add("neighbors must be > 0, got: " + neighbors);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    /**
     * @return a new instance with the same values
     */
    public LoopConfig copy() {
        LoopConfig copy = new LoopConfig(extent, neighbors);
        copy.setParallelClusters(parallelClusters);
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getExtent() {
        return extent;
    }

    public void setExtent(double extent) {
        this.extent = extent;
    }

    public int getNeighbors() {
        return neighbors;
    }

    public void setNeighbors(int neighbors) {
        this.neighbors = neighbors;
    }

    public boolean isParallelClusters() {
        return parallelClusters;
    }

    public void setParallelClusters(boolean parallelClusters) {
        this.parallelClusters = parallelClusters;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LoopConfig that))
            return false;
        return Double.compare(extent, that.extent) == 0
                && neighbors == that.neighbors
                && parallelClusters == that.parallelClusters;
    }

    @Override
    public int hashCode() {
        return Objects.hash(extent, neighbors, parallelClusters);
    }

    @Override
    public String toString() {
        return "LoopConfig{" +
                "extent=" + extent +
                ", neighbors=" + neighbors +
                ", parallelClusters=" + parallelClusters +
                '}';
    }
}
