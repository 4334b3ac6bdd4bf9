/**
 * Batch scoring job for the LoOP engine.
 *
 * <p>
 * Reads JSON-lines observations, scores them with
 * {@link com.loopscore.core.detection.LocalOutlierProbability} and writes one
 * JSON line per observation.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.loopscore.batch.LoopScoringJob}: main entry point</li>
 * <li>{@link com.loopscore.batch.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.loopscore.batch.ObservationReader} /
 * {@link com.loopscore.batch.ScoreWriter}: JSON input and output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.loopscore.batch;
