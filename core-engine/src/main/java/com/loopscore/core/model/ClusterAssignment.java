package com.loopscore.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps every observation of a {@link Dataset} to a cluster.
 *
 * <p>
 * Cluster labels may be any non-null value with proper {@code equals} /
 * {@code hashCode} (integers, strings, enums …). Internally each distinct
 * label is assigned a dense cluster index {@code 0..clusterCount()-1} in the
 * order the label is first seen; the original label stays available through
 * {@link #label(int)} for diagnostics.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClusterAssignment {

    private final int[] clusterOfRow;
    private final List<Object> labels;
    private final int[][] members;

    private ClusterAssignment(int[] clusterOfRow, List<Object> labels) {
        this.clusterOfRow = clusterOfRow;
        this.labels = Collections.unmodifiableList(labels);

        int[] counts = new int[labels.size()];
        for (int c : clusterOfRow) {
            counts[c]++;
        }
        this.members = new int[labels.size()][];
        for (int c = 0; c < counts.length; c++) {
            members[c] = new int[counts[c]];
        }
        int[] fill = new int[labels.size()];
        for (int row = 0; row < clusterOfRow.length; row++) {
            int c = clusterOfRow[row];
            members[c][fill[c]++] = row;
        }
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Assign all {@code size} observations to one cluster labelled {@code 0}.
     *
     * @param size number of observations; must be positive
     * @return single-cluster assignment
     */
    public static ClusterAssignment single(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, got: " + size);
        }
        return new ClusterAssignment(new int[size], new ArrayList<>(List.of(0)));
    }

    /**
     * Build an assignment from integer labels.
     *
     * @param labels one label per observation; must not be {@code null}
     * @return assignment over {@code labels.length} observations
     */
    public static ClusterAssignment of(int... labels) {
        Objects.requireNonNull(labels, "Cluster labels must not be null");
        List<Object> boxed = new ArrayList<>(labels.length);
        for (int label : labels) {
            boxed.add(label);
        }
        return of(boxed);
    }

    /**
     * Build an assignment from categorical labels.
     *
     * @param labels one label per observation; neither the list nor any
     *               element may be {@code null}
     * @return assignment over {@code labels.size()} observations
     * @throws IllegalArgumentException if {@code labels} is empty
     */
    public static ClusterAssignment of(List<?> labels) {
        Objects.requireNonNull(labels, "Cluster labels must not be null");
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("Cluster labels must not be empty");
        }
        Map<Object, Integer> index = new LinkedHashMap<>();
        int[] clusterOfRow = new int[labels.size()];
        for (int row = 0; row < clusterOfRow.length; row++) {
            Object label = Objects.requireNonNull(labels.get(row),
                    "Cluster label of row " + row + " must not be null");
            clusterOfRow[row] = index.computeIfAbsent(label, l -> index.size());
        }
        return new ClusterAssignment(clusterOfRow, new ArrayList<>(index.keySet()));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return number of observations covered by this assignment
     */
    public int size() {
        return clusterOfRow.length;
    }

    /**
     * @return number of distinct clusters
     */
    public int clusterCount() {
        return labels.size();
    }

    /**
     * Dense cluster index of an observation.
     *
     * @param row observation index
     * @return cluster index in {@code [0, clusterCount())}
     */
    public int clusterOf(int row) {
        return clusterOfRow[row];
    }

    /**
     * Original label of a cluster.
     *
     * @param cluster dense cluster index
     * @return the label as supplied by the caller
     */
    public Object label(int cluster) {
        return labels.get(cluster);
    }

    /**
     * @return unmodifiable list of labels, indexed by dense cluster index
     */
    public List<Object> labels() {
        return labels;
    }

    /**
     * Row indices belonging to a cluster, ascending.
     *
     * @param cluster dense cluster index
     * @return a fresh array of row indices
     */
    public int[] members(int cluster) {
        return members[cluster].clone();
    }

    /**
     * @param cluster dense cluster index
     * @return number of observations in the cluster
     */
    public int clusterSize(int cluster) {
        return members[cluster].length;
    }

    /**
     * @return dense index of the cluster with the fewest members (the first
     *         one on ties)
     */
    public int smallestCluster() {
        int smallest = 0;
        for (int c = 1; c < members.length; c++) {
            if (members[c].length < members[smallest].length) {
                smallest = c;
            }
        }
        return smallest;
    }

    @Override
    public String toString() {
        return "ClusterAssignment{size=" + clusterOfRow.length +
                ", clusters=" + labels +
                '}';
    }
}
