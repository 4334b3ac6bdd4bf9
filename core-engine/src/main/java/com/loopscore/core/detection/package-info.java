/**
 * Outlier detectors built on the probability pipeline.
 *
 * <p>
 * {@link com.loopscore.core.detection.LocalOutlierProbability} is the entry
 * point: it validates its inputs with
 * {@link com.loopscore.core.detection.InputValidator} and then runs the
 * {@link com.loopscore.core.pipeline.ProbabilityPipeline}. Scores are
 * probabilities; turning them into outlier / inlier decisions is left to the
 * caller.
 * </p>
 *
 * @since 1.0.0
 */
package com.loopscore.core.detection;
