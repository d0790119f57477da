package com.cellsentinel.flink;

import com.cellsentinel.core.model.CellGeometry;
import com.cellsentinel.core.model.TrafficObservation;
import com.cellsentinel.core.source.TelemetrySource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link TelemetrySource} reading newline-delimited JSON files.
 *
 * <p>
 * One object per line, blank lines skipped:
 * </p>
 *
 * <pre>
 * {"cell_id":"A1","datetime":"2024-01-01T10:00:00","traffic_cs":104.2,"traffic_data":3.9}
 * {"cell_id":"A1","site_id":"S1","latitude":40.41,"longitude":-3.70,"azimuth":90,"max_distance_km":5}
 * </pre>
 *
 * <p>
 * Unlike the per-record leniency of a streaming source, a line that cannot be
 * parsed aborts the load: a batch analysis over partially read telemetry
 * would silently skew every baseline. The same holds for a line that leaves
 * out a required field or sets it to {@code null}: the numeric model fields
 * are primitives and would otherwise read as {@code 0.0}.
 * </p>
 */
public class JsonLinesTelemetrySource implements TelemetrySource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesTelemetrySource.class);

    private static final List<String> TRAFFIC_FIELDS =
            List.of("cell_id", "datetime", "traffic_cs", "traffic_data");

    private static final List<String> GEOMETRY_FIELDS =
            List.of("cell_id", "site_id", "latitude", "longitude", "azimuth", "max_distance_km");

    private final Path trafficFile;
    private final Path geometryFile;
    private final ObjectMapper mapper = TelemetryJson.newMapper();

    public JsonLinesTelemetrySource(Path trafficFile, Path geometryFile) {
        this.trafficFile = Objects.requireNonNull(trafficFile, "Traffic file must not be null");
        this.geometryFile = Objects.requireNonNull(geometryFile, "Geometry file must not be null");
    }

    @Override
    public List<TrafficObservation> loadTraffic() {
        return read(trafficFile, TrafficObservation.class, TRAFFIC_FIELDS);
    }

    @Override
    public List<CellGeometry> loadGeometry() {
        return read(geometryFile, CellGeometry.class, GEOMETRY_FIELDS);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> List<T> read(Path file, Class<T> type, List<String> requiredFields) {
        List<T> records = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    throw malformed(type, file, lineNumber, e.getOriginalMessage(), e);
                }
                String problem = checkRequired(node, requiredFields);
                if (problem != null) {
                    throw malformed(type, file, lineNumber, problem, null);
                }
                try {
                    records.add(mapper.treeToValue(node, type));
                } catch (JsonProcessingException e) {
                    throw malformed(type, file, lineNumber, e.getOriginalMessage(), e);
                }
            }
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Input file not found: " + file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        LOG.info("Read {} {} record(s) from {}", records.size(), type.getSimpleName(), file);
        return records;
    }

    /**
     * @return a description of the missing or null fields, or {@code null}
     *         if every required field carries a value
     */
    private static String checkRequired(JsonNode node, List<String> requiredFields) {
        if (!node.isObject()) {
            return "expected a JSON object";
        }
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                missing.add(field);
            }
        }
        return missing.isEmpty() ? null : "missing or null required field(s) " + missing;
    }

    private static IllegalStateException malformed(Class<?> type, Path file, int lineNumber,
            String problem, Exception cause) {
        return new IllegalStateException(String.format(
                "Malformed %s record at %s:%d: %s",
                type.getSimpleName(), file, lineNumber, problem), cause);
    }
}
