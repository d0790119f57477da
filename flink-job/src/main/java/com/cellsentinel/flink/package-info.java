/**
 * Apache Flink batch job for Cell Sentinel.
 *
 * <p>
 * This package wires the core detection engine into a Flink pipeline that
 * reads JSON-lines telemetry, classifies each time-of-week partition in
 * parallel, and writes the anomaly report as JSON lines.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.cellsentinel.flink.CellSentinelJob}: main entry point</li>
 * <li>{@link com.cellsentinel.flink.ClassificationProcessFunction}: keyed
 * process function</li>
 * <li>{@link com.cellsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.cellsentinel.flink.AnomalyReportWriter}: result files</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cellsentinel.flink;
