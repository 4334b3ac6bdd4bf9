/**
 * Configuration of the LoOP detector.
 *
 * <p>
 * Parameters live in {@link com.loopscore.core.config.LoopConfig} and can be
 * read from YAML by {@link com.loopscore.core.config.LoopConfigLoader}.
 * Invalid values raise a
 * {@link com.loopscore.core.config.ConfigurationException} at load time.
 * </p>
 *
 * @since 1.0.0
 */
package com.loopscore.core.config;
