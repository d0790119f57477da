package com.cellsentinel.flink;

import com.cellsentinel.core.model.AnomalyReport;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;

/**
 * Writes the tables of an {@link AnomalyReport} as newline-delimited JSON.
 *
 * <h3>Files</h3>
 * <ul>
 * <li>{@value #COMBINED_TRAFFIC}: classified traffic of anomalous cells and
 * their neighbours</li>
 * <li>{@value #NEIGHBOR_MAPPING}: one {@code anomaly_cell → neighbor_cell}
 * pair per line</li>
 * <li>{@value #INVOLVED_GEOMETRY}: geometry of every cell in the mapping</li>
 * <li>{@value #SUSTAINED_ANOMALIES}: per-cell summary of the sustained
 * anomalies</li>
 * </ul>
 *
 * <p>
 * Existing files are replaced. Empty tables produce empty files, so consumers
 * can tell "nothing found" from "job did not run".
 * </p>
 */
public class AnomalyReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyReportWriter.class);

    public static final String COMBINED_TRAFFIC = "combined_traffic.jsonl";
    public static final String NEIGHBOR_MAPPING = "neighbor_mapping.jsonl";
    public static final String INVOLVED_GEOMETRY = "involved_geometry.jsonl";
    public static final String SUSTAINED_ANOMALIES = "sustained_anomalies.jsonl";

    private final ObjectWriter writer = TelemetryJson.newMapper().writer();

    /**
     * @param report    analysis result; must not be {@code null}
     * @param outputDir target directory, created when missing
     * @throws UncheckedIOException if a file cannot be written
     */
    public void write(AnomalyReport report, Path outputDir) {
        Objects.requireNonNull(report, "Report must not be null");
        Objects.requireNonNull(outputDir, "Output directory must not be null");

        try {
            Files.createDirectories(outputDir);
            writeLines(outputDir.resolve(COMBINED_TRAFFIC), report.getCombinedTraffic());
            writeLines(outputDir.resolve(NEIGHBOR_MAPPING), report.getNeighbors().getRelations());
            writeLines(outputDir.resolve(INVOLVED_GEOMETRY), report.getNeighbors().getInvolvedGeometry());
            writeLines(outputDir.resolve(SUSTAINED_ANOMALIES), report.getSustained().getAnomalies());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write anomaly report to " + outputDir, e);
        }
        LOG.info("Anomaly report written to {}", outputDir.toAbsolutePath());
    }

    private void writeLines(Path file, Collection<?> rows) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Object row : rows) {
                out.write(writer.writeValueAsString(row));
                out.newLine();
            }
        }
        LOG.debug("{}: {} line(s)", file.getFileName(), rows.size());
    }
}
