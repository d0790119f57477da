package com.cellsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for the classification operator.
 * <p>
 * Flink exposes these via its configured metric reporters; the job only
 * defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code observations_classified_total}: rows labelled</li>
 *   <li>{@code anomalous_slots_total}: rows with at least one non-STABLE label</li>
 *   <li>{@code partition_size}: histogram of rows per time-of-week partition</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter observationsClassified;
    private final Counter anomalousSlots;
    private final Histogram partitionSize;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup("cell_sentinel");

        this.observationsClassified = sentinelGroup.counter("observations_classified_total");
        this.anomalousSlots = sentinelGroup.counter("anomalous_slots_total");
        this.partitionSize = sentinelGroup
                .histogram("partition_size", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsClassified(long count) {
        observationsClassified.inc(count);
    }

    public void incrementAnomalousSlots() {
        anomalousSlots.inc();
    }

    public void recordPartitionSize(int rows) {
        partitionSize.update(rows);
    }
}
