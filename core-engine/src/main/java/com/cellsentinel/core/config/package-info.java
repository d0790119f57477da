/**
 * Configuration loading and validation for the anomaly analysis.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.cellsentinel.core.config.DetectionConfigLoader} into a
 * {@link com.cellsentinel.core.config.DetectionConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.config;
