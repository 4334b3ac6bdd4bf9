package com.loopscore.core.pipeline;

import com.loopscore.core.model.ClusterAssignment;
import com.loopscore.core.model.Dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Working state of one pipeline run: one row per observation, one column per
 * {@link StatisticsField}, plus one {@link ClusterStatistics} per cluster.
 *
 * <p>
 * All columns are allocated upfront. A column is <strong>append-only</strong>:
 * it is written exactly once by the stage that produces it via
 * {@link #populate(StatisticsField, double[])} and is readable only afterwards.
 * A new table is created for every run, so nothing carries over between calls.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Stages run sequentially
 * and only read a populated column or write their own.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsTable {

    private final Dataset dataset;
    private final ClusterAssignment assignment;
    private final List<ClusterStatistics> clusters;

    private final double[][] columns;
    private final Set<StatisticsField> populated = EnumSet.noneOf(StatisticsField.class);

    /**
     * @param dataset    observations to score; must not be {@code null}
     * @param assignment cluster of every observation; must not be {@code null}
     * @throws IllegalArgumentException if the sizes of the two inputs differ
     */
    public StatisticsTable(Dataset dataset, ClusterAssignment assignment) {
        this.dataset = Objects.requireNonNull(dataset, "Dataset must not be null");
        this.assignment = Objects.requireNonNull(assignment, "ClusterAssignment must not be null");
        if (dataset.size() != assignment.size()) {
            throw new IllegalArgumentException("Cluster assignment covers " + assignment.size()
                    + " observations, dataset has " + dataset.size());
        }

        List<ClusterStatistics> stats = new ArrayList<>(assignment.clusterCount());
        for (int c = 0; c < assignment.clusterCount(); c++) {
            stats.add(new ClusterStatistics(c, assignment.label(c), assignment.members(c)));
        }
        this.clusters = Collections.unmodifiableList(stats);

        this.columns = new double[StatisticsField.values().length][dataset.size()];
        for (double[] column : columns) {
            Arrays.fill(column, Double.NaN);
        }
    }

    // ---------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------

    /**
     * @return number of rows (observations)
     */
    public int size() {
        return dataset.size();
    }

    public Dataset getDataset() {
        return dataset;
    }

    public ClusterAssignment getAssignment() {
        return assignment;
    }

    // ---------------------------------------------------------------
    // Clusters
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable list of per-cluster aggregates, indexed by dense
     *         cluster index
     */
    public List<ClusterStatistics> getClusters() {
        return clusters;
    }

    /**
     * Aggregates of the cluster a row belongs to.
     *
     * @param row observation index
     * @return the cluster's statistics record
     */
    public ClusterStatistics clusterOf(int row) {
        return clusters.get(assignment.clusterOf(row));
    }

    /**
     * @param row observation index
     * @return the caller-supplied label of the row's cluster
     */
    public Object clusterLabel(int row) {
        return assignment.label(assignment.clusterOf(row));
    }

    // ---------------------------------------------------------------
    // Columns
    // ---------------------------------------------------------------

    /**
     * Fill a column. Each column can be populated once per table.
     *
     * @param field  column to fill
     * @param values one value per row; copied
     * @throws IllegalStateException    if the column was already populated
     * @throws IllegalArgumentException if {@code values} has the wrong length
     */
    public void populate(StatisticsField field, double[] values) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (populated.contains(field)) {
            throw new IllegalStateException("Column " + field.getColumnName() + " is already populated");
        }
        if (values.length != size()) {
            throw new IllegalArgumentException("Column " + field.getColumnName() + " needs "
                    + size() + " values, got: " + values.length);
        }
        System.arraycopy(values, 0, columns[field.ordinal()], 0, values.length);
        populated.add(field);
    }

    /**
     * @param field column to check
     * @return {@code true} once the column has been populated
     */
    public boolean isPopulated(StatisticsField field) {
        return populated.contains(field);
    }

    /**
     * Copy of a populated column.
     *
     * @param field column to read
     * @return a fresh array with one value per row
     * @throws IllegalStateException if the column has not been populated yet
     */
    public double[] column(StatisticsField field) {
        return requirePopulated(field).clone();
    }

    /**
     * Single value of a populated column.
     *
     * @param field column to read
     * @param row   observation index
     * @return the stored value, possibly NaN or infinite
     * @throws IllegalStateException if the column has not been populated yet
     */
    public double get(StatisticsField field, int row) {
        return requirePopulated(field)[row];
    }

    private double[] requirePopulated(StatisticsField field) {
        Objects.requireNonNull(field, "field must not be null");
        if (!populated.contains(field)) {
            throw new IllegalStateException("Column " + field.getColumnName() + " has not been populated");
        }
        return columns[field.ordinal()];
    }

    @Override
    public String toString() {
        return "StatisticsTable{rows=" + size() +
                ", clusters=" + clusters.size() +
                ", populated=" + populated +
                '}';
    }
}
