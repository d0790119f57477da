package com.cellsentinel.flink;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.config.DetectionConfigLoader;
import com.cellsentinel.core.detection.AnomalyPipeline;
import com.cellsentinel.core.detection.TimeOfWeekKey;
import com.cellsentinel.core.detection.WindowedAnomalyClassifier;
import com.cellsentinel.core.geo.GeometryTable;
import com.cellsentinel.core.model.AnomalyReport;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.TrafficObservation;
import com.cellsentinel.core.source.TelemetrySource;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.api.java.functions.KeySelector;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the Cell Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   traffic.jsonl + geometry.jsonl
 *     → JsonLinesTelemetrySource (validate)
 *     → Key by time-of-week partition (cell|weekday|hour)
 *     → ClassificationProcessFunction (rolling baseline, labels)
 *     → collect
 *     → AnomalyPipeline.analyze (sustained filter, facing neighbours)
 *     → AnomalyReportWriter (output dir)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths and parallelism come from environment variables via
 * {@link JobConfig}; detection parameters from YAML via
 * {@link DetectionConfigLoader}.
 * </p>
 *
 * <p>
 * The job runs in {@link RuntimeExecutionMode#BATCH}: the input is bounded,
 * and any error fails the whole run.
 * </p>
 *
 * @since 1.0.0
 */
public final class CellSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(CellSentinelJob.class);

        private CellSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Cell Sentinel with config: {}", config);
                DetectionConfig detectionConfig = loadDetectionConfig(config);

                // 2. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setRuntimeMode(RuntimeExecutionMode.BATCH);
                env.setParallelism(config.getParallelism());

                // 3. Run and write the report
                AnomalyReport report = run(env, config, detectionConfig);
                LOG.info("Cell Sentinel finished: {} anomalous cell(s), {} neighbour relation(s)",
                                report.getSustained().getAnomalousCells().size(),
                                report.getNeighbors().getRelations().size());
        }

        // ---------------------------------------------------------------
        // Pipeline assembly (extracted for readability and testability)
        // ---------------------------------------------------------------

        /**
         * Read the inputs, classify on Flink, analyse and write the report.
         */
        static AnomalyReport run(StreamExecutionEnvironment env,
                        JobConfig config,
                        DetectionConfig detectionConfig) throws Exception {
                TelemetrySource source = new JsonLinesTelemetrySource(
                                Path.of(config.getTrafficInputPath()),
                                Path.of(config.getGeometryInputPath()));

                // Fail on malformed input before the cluster does any work
                GeometryTable geometry = new GeometryTable(source.loadGeometry());
                List<TrafficObservation> traffic = source.loadTraffic();
                traffic.forEach(TrafficObservation::validate);

                AnomalyPipeline pipeline = new AnomalyPipeline(detectionConfig);
                List<ClassifiedObservation> classified = classify(env, traffic, pipeline.getClassifier());

                AnomalyReport report = pipeline.analyze(classified, geometry);
                new AnomalyReportWriter().write(report, Path.of(config.getOutputDir()));
                return report;
        }

        /**
         * Classify every time-of-week partition in parallel.
         *
         * @return classified rows ordered by cell, then timestamp
         */
        static List<ClassifiedObservation> classify(StreamExecutionEnvironment env,
                        List<TrafficObservation> traffic,
                        WindowedAnomalyClassifier classifier) throws Exception {
                if (traffic.isEmpty()) {
                        LOG.warn("No traffic rows, skipping classification");
                        return List.of();
                }

                DataStream<ClassifiedObservation> classified = env
                                .fromCollection(traffic, TypeInformation.of(TrafficObservation.class))
                                .name("traffic-source")
                                .keyBy(new PartitionKeySelector(), Types.STRING)
                                .process(new ClassificationProcessFunction(classifier))
                                .name("windowed-classification");

                List<ClassifiedObservation> rows = new ArrayList<>(traffic.size());
                try (CloseableIterator<ClassifiedObservation> it =
                                classified.executeAndCollect("Cell Sentinel - Windowed Classification")) {
                        it.forEachRemaining(rows::add);
                }
                rows.sort(TrafficObservation.BY_CELL_AND_TIME);
                LOG.info("Classified {} row(s)", rows.size());
                return rows;
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static DetectionConfig loadDetectionConfig(JobConfig config) {
                if (config.hasDetectionConfigPath()) {
                        return DetectionConfigLoader.fromFile(config.getDetectionConfigPath());
                }
                return DetectionConfigLoader.load();
        }

        /** Keys a row by its (cell, weekday, hour) partition. */
        static final class PartitionKeySelector implements KeySelector<TrafficObservation, String> {

                private static final long serialVersionUID = 1L;

                @Override
                public String getKey(TrafficObservation observation) {
                        return TimeOfWeekKey.of(observation).asString();
                }
        }
}
