/**
 * Input model of the LoOP engine.
 *
 * <ul>
 * <li>{@link com.loopscore.core.model.Dataset}: immutable numeric
 * observation matrix, NaN marks a missing value</li>
 * <li>{@link com.loopscore.core.model.ClusterAssignment}: observation to
 * cluster mapping, integer or categorical labels</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.loopscore.core.model;
