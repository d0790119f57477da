package com.cellsentinel.flink;

import com.cellsentinel.core.detection.WindowedAnomalyClassifier;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.TrafficObservation;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that classifies one time-of-week
 * partition per key.
 *
 * <p>
 * The stream is keyed by {@link com.cellsentinel.core.detection.TimeOfWeekKey},
 * so every key holds the rows of a single (cell, weekday, hour) slot. A
 * rolling baseline needs those rows in timestamp order, which Flink does not
 * guarantee; rows are therefore buffered and classified together once the
 * input of the key is complete.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ListState<TrafficObservation>} buffers the rows of the current
 * key. An event-time timer at {@link Long#MAX_VALUE} fires when the final
 * watermark arrives, which in {@code BATCH} mode is the end of the key's
 * input.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationProcessFunction
        extends KeyedProcessFunction<String, TrafficObservation, ClassifiedObservation> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ClassificationProcessFunction.class);

    private final WindowedAnomalyClassifier classifier;

    /** Rows of the current partition, unordered. */
    private transient ListState<TrafficObservation> partitionState;

    /** Custom Flink metrics. */
    private transient SentinelMetrics metrics;

    public ClassificationProcessFunction(WindowedAnomalyClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "Classifier must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        partitionState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("partition-rows", TrafficObservation.class));

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("ClassificationProcessFunction opened (csMultiplier={}, dataMultiplier={}, window={})",
                classifier.getCsMultiplier(), classifier.getDataMultiplier(), classifier.getClassificationWindow());
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(TrafficObservation observation,
            KeyedProcessFunction<String, TrafficObservation, ClassifiedObservation>.Context ctx,
            Collector<ClassifiedObservation> out) throws Exception {
        partitionState.add(observation);
        // Same timestamp for every row: Flink keeps a single timer per key
        ctx.timerService().registerEventTimeTimer(Long.MAX_VALUE);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, TrafficObservation, ClassifiedObservation>.OnTimerContext ctx,
            Collector<ClassifiedObservation> out) throws Exception {
        List<TrafficObservation> rows = new ArrayList<>();
        for (TrafficObservation row : partitionState.get()) {
            rows.add(row);
        }
        partitionState.clear();

        List<ClassifiedObservation> classified = classifier.classifyPartition(rows);
        for (ClassifiedObservation row : classified) {
            if (row.isAnomalous()) {
                metrics.incrementAnomalousSlots();
            }
            out.collect(row);
        }

        metrics.incrementObservationsClassified(classified.size());
        metrics.recordPartitionSize(classified.size());
        LOG.debug("Partition [{}] classified: {} row(s)", ctx.getCurrentKey(), classified.size());
    }
}
