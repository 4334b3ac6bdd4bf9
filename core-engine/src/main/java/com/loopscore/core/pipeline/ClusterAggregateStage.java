package com.loopscore.core.pipeline;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base class for stages that reduce one column per cluster and broadcast the
 * result back to every member row.
 *
 * <p>
 * NaN values are excluded before {@link #aggregate(double[])} is called, so a
 * missing input only affects its own row. The aggregate is stored once in the
 * cluster's {@link ClusterStatistics} and then copied to the members.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class ClusterAggregateStage implements PipelineStage {

    private final StatisticsField input;
    private final StatisticsField output;

    protected ClusterAggregateStage(StatisticsField input, StatisticsField output) {
        this.input = Objects.requireNonNull(input, "input field must not be null");
        this.output = Objects.requireNonNull(output, "output field must not be null");
    }

    @Override
    public void apply(StatisticsTable table) {
        double[] values = table.column(input);
        double[] broadcast = new double[table.size()];

        for (ClusterStatistics cluster : table.getClusters()) {
            double aggregate = aggregate(nonMissing(values, cluster));
            record(cluster, aggregate);
            for (int i = 0; i < cluster.size(); i++) {
                broadcast[cluster.member(i)] = aggregate;
            }
        }

        table.populate(output, broadcast);
    }

    /**
     * Reduce the non-NaN values of one cluster.
     *
     * @param values member values without NaN, possibly empty
     * @return the cluster aggregate
     */
    protected abstract double aggregate(double[] values);

    /**
     * Store the aggregate in the cluster record. May reject it.
     *
     * @param cluster   cluster being processed
     * @param aggregate value returned by {@link #aggregate(double[])}
     * @throws DegenerateClusterException if the aggregate makes the cluster unusable
     */
    protected abstract void record(ClusterStatistics cluster, double aggregate);

    /**
     * Arithmetic mean, NaN for an empty input.
     */
    protected static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    protected static double sumOfSquares(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v * v;
        }
        return sum;
    }

    private static double[] nonMissing(double[] values, ClusterStatistics cluster) {
        double[] buffer = new double[cluster.size()];
        int count = 0;
        for (int i = 0; i < cluster.size(); i++) {
            double v = values[cluster.member(i)];
            if (!Double.isNaN(v)) {
                buffer[count++] = v;
            }
        }
        return count == buffer.length ? buffer : Arrays.copyOf(buffer, count);
    }
}
