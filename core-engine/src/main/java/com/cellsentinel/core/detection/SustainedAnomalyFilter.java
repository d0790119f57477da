package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.Signal;
import com.cellsentinel.core.model.SustainedAnomaly;
import com.cellsentinel.core.model.SustainedAnomalyResult;
import com.cellsentinel.core.model.TrafficObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Selects the cells that stayed anomalous over a trailing horizon.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Take the latest timestamp of the whole table and keep rows strictly
 * after {@code latest − anomalyWindowHours} (a global horizon, not per
 * cell).</li>
 * <li>Map every label to {@link com.cellsentinel.core.model.TrafficLabel#indicator()}.</li>
 * <li>Per cell, in timestamp order, sum the indicators of the most recent
 * {@code anomalyWindowHours} rows, separately for CS and DATA.</li>
 * <li>A cell qualifies if either sum reaches {@code minAnomalies} at any row of
 * the horizon.</li>
 * </ol>
 *
 * <p>
 * One row per hour is assumed, so the row-count window and the hour horizon
 * coincide.
 * </p>
 *
 * @since 1.0.0
 */
public class SustainedAnomalyFilter {

    private static final Logger LOG = LoggerFactory.getLogger(SustainedAnomalyFilter.class);

    private final int anomalyWindowHours;
    private final int minAnomalies;

    /**
     * @throws IllegalArgumentException if either parameter is &lt; 1
     */
    public SustainedAnomalyFilter(int anomalyWindowHours, int minAnomalies) {
        if (anomalyWindowHours < 1) {
            throw new IllegalArgumentException(
                    "anomalyWindowHours must be >= 1, got: " + anomalyWindowHours);
        }
        if (minAnomalies < 1) {
            throw new IllegalArgumentException("minAnomalies must be >= 1, got: " + minAnomalies);
        }
        this.anomalyWindowHours = anomalyWindowHours;
        this.minAnomalies = minAnomalies;
    }

    public static SustainedAnomalyFilter from(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        return new SustainedAnomalyFilter(config.getAnomalyWindowHours(), config.getMinAnomalies());
    }

    /**
     * Evaluate every cell of the classified table.
     *
     * @param classified classified rows of all cells; must not be {@code null}
     * @return qualifying cells and their complete classified history
     */
    public SustainedAnomalyResult select(List<ClassifiedObservation> classified) {
        Objects.requireNonNull(classified, "Classified observations must not be null");

        Optional<LocalDateTime> latest = classified.stream()
                .map(TrafficObservation::getDatetime)
                .max(Comparator.naturalOrder());
        if (latest.isEmpty()) {
            LOG.info("No classified rows, no sustained anomaly");
            return SustainedAnomalyResult.empty();
        }

        LocalDateTime windowEnd = latest.get();
        LocalDateTime windowStart = windowEnd.minusHours(anomalyWindowHours);

        Map<String, List<ClassifiedObservation>> horizonByCell = new LinkedHashMap<>();
        for (ClassifiedObservation row : classified) {
            if (row.getDatetime().isAfter(windowStart)) {
                horizonByCell.computeIfAbsent(row.getCellId(), k -> new ArrayList<>()).add(row);
            }
        }

        List<SustainedAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<ClassifiedObservation>> entry : horizonByCell.entrySet()) {
            evaluateCell(entry.getKey(), entry.getValue(), windowStart, windowEnd)
                    .ifPresent(anomalies::add);
        }
        anomalies.sort(Comparator.comparing(SustainedAnomaly::getCellId));

        Set<String> cells = new HashSet<>();
        anomalies.forEach(a -> cells.add(a.getCellId()));
        List<ClassifiedObservation> history = classified.stream()
                .filter(row -> cells.contains(row.getCellId()))
                .sorted(TrafficObservation.BY_CELL_AND_TIME)
                .toList();

        LOG.info("{} of {} cell(s) anomalous in the {}h horizon ending {}",
                anomalies.size(), horizonByCell.size(), anomalyWindowHours, windowEnd);
        return new SustainedAnomalyResult(anomalies, history);
    }

    public int getAnomalyWindowHours() {
        return anomalyWindowHours;
    }

    public int getMinAnomalies() {
        return minAnomalies;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<SustainedAnomaly> evaluateCell(String cellId, List<ClassifiedObservation> rows,
            LocalDateTime windowStart, LocalDateTime windowEnd) {
        List<ClassifiedObservation> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparing(TrafficObservation::getDatetime));

        Deque<ClassifiedObservation> trailing = new ArrayDeque<>();
        int csSum = 0;
        int dataSum = 0;
        int peakCs = 0;
        int peakData = 0;

        for (ClassifiedObservation row : ordered) {
            trailing.addLast(row);
            csSum += row.labelOf(Signal.CS).indicator();
            dataSum += row.labelOf(Signal.DATA).indicator();

            if (trailing.size() > anomalyWindowHours) {
                ClassifiedObservation evicted = trailing.pollFirst();
                csSum -= evicted.labelOf(Signal.CS).indicator();
                dataSum -= evicted.labelOf(Signal.DATA).indicator();
            }

            peakCs = Math.max(peakCs, csSum);
            peakData = Math.max(peakData, dataSum);
        }

        boolean csSustained = peakCs >= minAnomalies;
        boolean dataSustained = peakData >= minAnomalies;
        if (!csSustained && !dataSustained) {
            return Optional.empty();
        }

        LOG.debug("Cell [{}] sustained: cs={} data={} (min={})", cellId, peakCs, peakData, minAnomalies);
        return Optional.of(SustainedAnomaly.builder()
                .cellId(cellId)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .peakCsCount(peakCs)
                .peakDataCount(peakData)
                .csSustained(csSustained)
                .dataSustained(dataSustained)
                .build());
    }
}
