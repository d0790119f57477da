package com.cellsentinel.flink;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.detection.WindowedAnomalyClassifier;
import com.cellsentinel.core.model.AnomalyReport;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.FacingRelation;
import com.cellsentinel.core.model.TrafficObservation;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the batch job on a local Flink mini cluster.
 */
class CellSentinelJobTest {

    /** A Monday, 10:00. */
    private static final LocalDateTime MONDAY_10 = LocalDateTime.of(2024, 1, 1, 10, 0);

    @TempDir
    Path dir;

    private StreamExecutionEnvironment env;

    @BeforeEach
    void setUp() {
        env = StreamExecutionEnvironment.createLocalEnvironment(2);
        env.setRuntimeMode(RuntimeExecutionMode.BATCH);
    }

    @Test
    @DisplayName("Should classify on Flink exactly as the in-memory classifier does")
    void shouldMatchInMemoryClassification() throws Exception {
        List<TrafficObservation> traffic = new ArrayList<>();
        for (int week = 0; week < 6; week++) {
            for (int hour = 0; hour < 3; hour++) {
                LocalDateTime at = MONDAY_10.plusWeeks(week).plusHours(hour);
                traffic.add(new TrafficObservation("A1", at, 100 + 7 * week * hour, 20 + week));
                traffic.add(new TrafficObservation("B7", at, 50 - week, 10 * hour));
            }
        }
        WindowedAnomalyClassifier classifier = new WindowedAnomalyClassifier(1.0, 1.0, 3);

        List<ClassifiedObservation> onFlink = CellSentinelJob.classify(env, traffic, classifier);

        assertThat(onFlink).containsExactlyElementsOf(classifier.classify(traffic));
    }

    @Test
    @DisplayName("Should run end to end from JSON-lines input to report files")
    void shouldRunEndToEnd() throws Exception {
        Path trafficFile = dir.resolve("traffic.jsonl");
        Path geometryFile = dir.resolve("geometry.jsonl");
        Path outputDir = dir.resolve("out");
        writeTraffic(trafficFile);
        Files.writeString(geometryFile,
                "{\"cell_id\":\"A1\",\"site_id\":\"S1\",\"latitude\":40.0,\"longitude\":-3.0,"
                        + "\"azimuth\":90,\"max_distance_km\":5}\n"
                        + "{\"cell_id\":\"A2\",\"site_id\":\"S2\",\"latitude\":40.0,\"longitude\":-2.9765,"
                        + "\"azimuth\":270,\"max_distance_km\":5}\n");

        JobConfig config = new JobConfig.Builder()
                .trafficInputPath(trafficFile.toString())
                .geometryInputPath(geometryFile.toString())
                .outputDir(outputDir.toString())
                .build();
        DetectionConfig detection = new DetectionConfig();
        detection.setCsMultiplier(1.5);
        detection.setClassificationWindow(30);
        detection.setAnomalyWindowHours(12);
        detection.setMinAnomalies(1);

        AnomalyReport report = CellSentinelJob.run(env, config, detection);

        assertThat(report.getClassified()).hasSize(48);
        assertThat(report.getSustained().getAnomalousCells()).containsExactly("A1");
        assertThat(report.getNeighbors().getRelations()).containsExactly(new FacingRelation("A1", "A2"));
        assertThat(Files.readAllLines(outputDir.resolve(AnomalyReportWriter.COMBINED_TRAFFIC))).hasSize(48);
        assertThat(Files.readAllLines(outputDir.resolve(AnomalyReportWriter.NEIGHBOR_MAPPING)))
                .containsExactly("{\"anomaly_cell\":\"A1\",\"neighbor_cell\":\"A2\"}");
    }

    @Test
    @DisplayName("Should skip the cluster for empty traffic")
    void shouldHandleEmptyTraffic() throws Exception {
        List<ClassifiedObservation> classified = CellSentinelJob.classify(
                env, List.of(), new WindowedAnomalyClassifier(2.0, 2.0, 4));

        assertThat(classified).isEmpty();
    }

    @Test
    @DisplayName("Should key rows by cell, weekday and hour")
    void shouldKeyByTimeOfWeek() {
        CellSentinelJob.PartitionKeySelector selector = new CellSentinelJob.PartitionKeySelector();

        String monday = selector.getKey(new TrafficObservation("A1", MONDAY_10, 1, 1));
        String nextMonday = selector.getKey(new TrafficObservation("A1", MONDAY_10.plusWeeks(1), 1, 1));
        String tuesday = selector.getKey(new TrafficObservation("A1", MONDAY_10.plusDays(1), 1, 1));

        assertThat(monday).isEqualTo(nextMonday).isNotEqualTo(tuesday);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * 24 weekly Monday 10:00 rows for A1 ending in a CS spike, flat rows for A2.
     */
    private static void writeTraffic(Path file) throws IOException {
        StringBuilder lines = new StringBuilder();
        for (int week = 0; week < 24; week++) {
            double cs;
            if (week < 22) {
                cs = week % 2 == 0 ? 90 : 110;
            } else if (week == 22) {
                cs = 100;
            } else {
                cs = 200;
            }
            LocalDateTime at = MONDAY_10.plusWeeks(week);
            lines.append(line("A1", at, cs, 40)).append('\n');
            lines.append(line("A2", at, 50, 50)).append('\n');
        }
        Files.writeString(file, lines.toString());
    }

    private static String line(String cellId, LocalDateTime at, double cs, double data) {
        return String.format(Locale.ROOT,
                "{\"cell_id\":\"%s\",\"datetime\":\"%s\",\"traffic_cs\":%s,\"traffic_data\":%s}",
                cellId, at, cs, data);
    }
}
