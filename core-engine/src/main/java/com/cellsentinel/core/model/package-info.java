/**
 * Domain model classes for Cell Sentinel.
 *
 * <p>
 * Input rows ({@link com.cellsentinel.core.model.TrafficObservation},
 * {@link com.cellsentinel.core.model.CellGeometry}) are Flink-compatible POJOs
 * shared between the detection engine and the batch job layer. Derived tables
 * are:
 * </p>
 * <ul>
 * <li>{@link com.cellsentinel.core.model.ClassifiedObservation}: a traffic row
 * with rolling statistics and labels</li>
 * <li>{@link com.cellsentinel.core.model.SustainedAnomaly}: a cell that stayed
 * anomalous over the trailing horizon</li>
 * <li>{@link com.cellsentinel.core.model.FacingRelation}: anomaly → neighbour
 * pair</li>
 * <li>{@link com.cellsentinel.core.model.AnomalyReport}: the result of one
 * pipeline run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cellsentinel.core.model;
