/**
 * The LoOP probability pipeline.
 *
 * <p>
 * {@link com.loopscore.core.pipeline.ProbabilityPipeline} runs a fixed
 * sequence of {@link com.loopscore.core.pipeline.PipelineStage}s, each filling
 * one column of a {@link com.loopscore.core.pipeline.StatisticsTable}.
 * Per-cluster reductions extend
 * {@link com.loopscore.core.pipeline.ClusterAggregateStage} and keep their
 * results in {@link com.loopscore.core.pipeline.ClusterStatistics}.
 * </p>
 *
 * <h3>Missing values</h3>
 * <p>
 * NaN is never an error here. It flows through the element-wise stages and is
 * skipped by the cluster aggregates, so it only shows up in the rows whose
 * input contained it. A cluster without dispersion is an error and raises
 * {@link com.loopscore.core.pipeline.DegenerateClusterException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.loopscore.core.pipeline;
