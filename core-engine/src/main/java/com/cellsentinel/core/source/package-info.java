/**
 * Input seam of the analysis.
 *
 * <p>
 * {@link com.cellsentinel.core.source.TelemetrySource} is injected into
 * {@link com.cellsentinel.core.detection.AnomalyPipeline}; databases, files or
 * notebooks plug in behind it.
 * </p>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.source;
