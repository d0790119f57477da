/**
 * Anomaly detection engine.
 *
 * <ul>
 * <li>{@link com.cellsentinel.core.detection.WindowedAnomalyClassifier}:
 * mean ± k × σ against the rolling baseline of each time-of-week slot</li>
 * <li>{@link com.cellsentinel.core.detection.SustainedAnomalyFilter}: cells
 * with enough anomalous slots in the trailing horizon</li>
 * <li>{@link com.cellsentinel.core.detection.NeighborTrafficAggregator}:
 * facing cells of every anomaly and their traffic</li>
 * <li>{@link com.cellsentinel.core.detection.AnomalyPipeline}: the three
 * stages chained</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.detection;
