/**
 * Configuration loading and validation for the analytics engine.
 *
 * <p>
 * Tunables are defined in YAML and loaded by
 * {@link com.processlens.core.config.AnalysisConfigLoader} into an
 * {@link com.processlens.core.config.AnalysisConfig} instance. Validation
 * runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.processlens.core.config;
