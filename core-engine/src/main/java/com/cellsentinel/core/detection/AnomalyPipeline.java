package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.geo.DirectionalNeighborResolver;
import com.cellsentinel.core.geo.GeometryTable;
import com.cellsentinel.core.model.AnomalyReport;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.NeighborAnalysis;
import com.cellsentinel.core.model.SustainedAnomalyResult;
import com.cellsentinel.core.model.TrafficObservation;
import com.cellsentinel.core.source.TelemetrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * End-to-end anomaly analysis over one batch of telemetry.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   traffic
 *     → WindowedAnomalyClassifier   (labels per signal)
 *     → SustainedAnomalyFilter      (anomalous cells + their history)
 *     → NeighborTrafficAggregator   (facing cells + their history)
 *     → combined traffic table
 * </pre>
 *
 * <p>
 * {@link #analyze(List, GeometryTable)} starts after classification so that
 * callers classifying partitions in parallel elsewhere can reuse the rest of
 * the chain.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyPipeline.class);

    private final WindowedAnomalyClassifier classifier;
    private final SustainedAnomalyFilter filter;
    private final NeighborTrafficAggregator aggregator;

    /**
     * @param config validated detection parameters
     */
    public AnomalyPipeline(DetectionConfig config) {
        this(WindowedAnomalyClassifier.from(config),
                SustainedAnomalyFilter.from(config),
                new NeighborTrafficAggregator(new DirectionalNeighborResolver(config.getHalfBeamwidth())));
    }

    public AnomalyPipeline(WindowedAnomalyClassifier classifier,
            SustainedAnomalyFilter filter,
            NeighborTrafficAggregator aggregator) {
        this.classifier = Objects.requireNonNull(classifier, "Classifier must not be null");
        this.filter = Objects.requireNonNull(filter, "Filter must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "Aggregator must not be null");
    }

    /**
     * Load both inputs from {@code source} and run the full chain. Geometry is
     * validated before any traffic is classified.
     */
    public AnomalyReport run(TelemetrySource source) {
        Objects.requireNonNull(source, "TelemetrySource must not be null");
        GeometryTable geometry = new GeometryTable(source.loadGeometry());
        return run(source.loadTraffic(), geometry);
    }

    public AnomalyReport run(List<TrafficObservation> traffic, GeometryTable geometry) {
        Objects.requireNonNull(traffic, "Traffic must not be null");
        Objects.requireNonNull(geometry, "Geometry table must not be null");
        return analyze(classifier.classify(traffic), geometry);
    }

    /**
     * Run the stages that follow classification.
     *
     * @param classified classified rows of all cells
     * @param geometry   validated geometry table
     * @return the report; its tables are empty, never {@code null}, when no
     *         cell is anomalous
     */
    public AnomalyReport analyze(List<ClassifiedObservation> classified, GeometryTable geometry) {
        Objects.requireNonNull(classified, "Classified observations must not be null");
        Objects.requireNonNull(geometry, "Geometry table must not be null");

        SustainedAnomalyResult sustained = filter.select(classified);
        NeighborAnalysis neighbors = aggregator.aggregate(classified, sustained.getAnomalousCells(), geometry);
        List<ClassifiedObservation> combined = NeighborTrafficAggregator.combine(
                sustained.getAnomalyTraffic(), neighbors.getNeighborTraffic());

        AnomalyReport report = new AnomalyReport(classified, sustained, neighbors, combined);
        LOG.info("Analysis complete: {}", report);
        return report;
    }

    public WindowedAnomalyClassifier getClassifier() {
        return classifier;
    }
}
