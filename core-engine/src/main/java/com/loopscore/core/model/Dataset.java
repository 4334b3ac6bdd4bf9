package com.loopscore.core.model;

import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable n&times;d matrix of real-valued observations.
 *
 * <p>
 * Each row is one observation and each column one feature. Missing values are
 * represented as {@link Double#NaN}; they are accepted here and only affect the
 * scores of the rows that contain them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * {@link #of(double[][])} copies the supplied rows, so later changes to the
 * caller's arrays are not visible through this instance. The matrix must be
 * non-empty and rectangular.
 * </p>
 *
 * @since 1.0.0
 */
public final class Dataset {

    private final double[][] rows;
    private final int dimensions;
    private final int missingRows;

    private Dataset(double[][] rows, int dimensions) {
        this.rows = rows;
        this.dimensions = dimensions;
        int missing = 0;
        for (double[] row : rows) {
            if (containsNaN(row)) {
                missing++;
            }
        }
        this.missingRows = missing;
    }

    /**
     * Create a dataset from a row-major matrix.
     *
     * @param rows observation rows; must not be {@code null}
     * @return dataset holding a copy of {@code rows}
     * @throws NullPointerException     if {@code rows} or any row is {@code null}
     * @throws IllegalArgumentException if the matrix is empty, has zero columns
     *                                  or is ragged
     */
    public static Dataset of(double[][] rows) {
        Objects.requireNonNull(rows, "Dataset rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("Dataset must contain at least one observation");
        }
        int dimensions = Objects.requireNonNull(rows[0], "Row 0 must not be null").length;
        if (dimensions == 0) {
            throw new IllegalArgumentException("Dataset must contain at least one feature");
        }
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            double[] row = Objects.requireNonNull(rows[i], "Row " + i + " must not be null");
            if (row.length != dimensions) {
                throw new IllegalArgumentException(
                        "Row " + i + " has " + row.length + " features, expected " + dimensions);
            }
            copy[i] = row.clone();
        }
        return new Dataset(copy, dimensions);
    }

    /**
     * @return number of observations (rows)
     */
    public int size() {
        return rows.length;
    }

    /**
     * @return number of features (columns)
     */
    public int dimensions() {
        return dimensions;
    }

    /**
     * Value of one feature of one observation.
     *
     * @param row    observation index
     * @param column feature index
     * @return the stored value, possibly NaN
     */
    public double get(int row, int column) {
        return rows[row][column];
    }

    /**
     * Return a copy of one observation.
     *
     * @param row observation index
     * @return a fresh array of length {@link #dimensions()}
     */
    public double[] row(int row) {
        return rows[row].clone();
    }

    /**
     * Euclidean distance between two observations.
     *
     * <p>
     * NaN in either row yields NaN.
     * </p>
     */
    public double distance(int a, int b) {
        return MathArrays.distance(rows[a], rows[b]);
    }

    /**
     * @return {@code true} if at least one value in the matrix is NaN
     */
    public boolean hasMissingValues() {
        return missingRows > 0;
    }

    /**
     * @return number of observations that contain at least one NaN
     */
    public int missingRowCount() {
        return missingRows;
    }

    private static boolean containsNaN(double[] row) {
        for (double v : row) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Dataset that))
            return false;
        return Arrays.deepEquals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "Dataset{size=" + rows.length +
                ", dimensions=" + dimensions +
                ", missingRows=" + missingRows +
                '}';
    }
}
