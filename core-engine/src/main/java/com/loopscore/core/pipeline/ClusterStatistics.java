package com.loopscore.core.pipeline;

/**
 * Aggregate statistics of one cluster for a single pipeline run.
 *
 * <p>
 * One instance per cluster is created together with the
 * {@link StatisticsTable}; the aggregate stages fill its values and then
 * broadcast them to the cluster's member rows. Values are NaN until the
 * corresponding stage has run.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Each instance is written by exactly one stage.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClusterStatistics {

    private final int index;
    private final Object label;
    private final int[] members;

    private double sumSquaredDistance = Double.NaN;
    private double expectedProbSetDistance = Double.NaN;
    private double expectedPlofSquared = Double.NaN;

    ClusterStatistics(int index, Object label, int[] members) {
        this.index = index;
        this.label = label;
        this.members = members;
    }

    /**
     * @return dense cluster index
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return cluster label as supplied by the caller
     */
    public Object getLabel() {
        return label;
    }

    /**
     * @return number of member observations
     */
    public int size() {
        return members.length;
    }

    /**
     * @return a fresh array of member row indices, ascending
     */
    public int[] getMembers() {
        return members.clone();
    }

    int member(int i) {
        return members[i];
    }

    public double getSumSquaredDistance() {
        return sumSquaredDistance;
    }

    void setSumSquaredDistance(double sumSquaredDistance) {
        this.sumSquaredDistance = sumSquaredDistance;
    }

    public double getExpectedProbSetDistance() {
        return expectedProbSetDistance;
    }

    void setExpectedProbSetDistance(double expectedProbSetDistance) {
        this.expectedProbSetDistance = expectedProbSetDistance;
    }

    public double getExpectedPlofSquared() {
        return expectedPlofSquared;
    }

    void setExpectedPlofSquared(double expectedPlofSquared) {
        this.expectedPlofSquared = expectedPlofSquared;
    }

    @Override
    public String toString() {
        return "ClusterStatistics{" +
                "label=" + label +
                ", size=" + members.length +
                ", ssd=" + sumSquaredDistance +
                ", evProbSetDistance=" + expectedProbSetDistance +
                ", evPlofSquared=" + expectedPlofSquared +
                '}';
    }
}
