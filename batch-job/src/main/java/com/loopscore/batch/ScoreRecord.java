package com.loopscore.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Output record: the Local Outlier Probability of one input row.
 *
 * <p>
 * Serialized to one JSON line per row. {@code probability} is written as
 * {@code null} when the score is undefined (NaN, caused by missing input
 * values); {@code id} and {@code cluster} are omitted when not configured.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"row", "id", "cluster", "probability"})
public class ScoreRecord {

    /** Zero-based position of the row in the input. */
    private final int row;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String id;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String cluster;

    /** Probability in [0, 1], {@code null} when undefined. */
    private final Double probability;

    public ScoreRecord(int row, String id, String cluster, double probability) {
        this.row = row;
        this.id = id;
        this.cluster = cluster;
        this.probability = Double.isNaN(probability) ? null : probability;
    }

    public int getRow() {
        return row;
    }

    public String getId() {
        return id;
    }

    public String getCluster() {
        return cluster;
    }

    public Double getProbability() {
        return probability;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoreRecord that))
            return false;
        return row == that.row
                && Objects.equals(id, that.id)
                && Objects.equals(cluster, that.cluster)
                && Objects.equals(probability, that.probability);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, id, cluster, probability);
    }

    @Override
    public String toString() {
        return "ScoreRecord{" +
                "row=" + row +
                ", id='" + id + '\'' +
                ", cluster='" + cluster + '\'' +
                ", probability=" + probability +
                '}';
    }
}
