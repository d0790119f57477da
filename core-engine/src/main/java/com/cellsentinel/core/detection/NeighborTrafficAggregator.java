package com.cellsentinel.core.detection;

import com.cellsentinel.core.geo.DirectionalNeighborResolver;
import com.cellsentinel.core.geo.GeometryTable;
import com.cellsentinel.core.model.CellGeometry;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.FacingRelation;
import com.cellsentinel.core.model.NeighborAnalysis;
import com.cellsentinel.core.model.TrafficObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Attaches neighbour context to the anomalous cells.
 *
 * <p>
 * For every anomalous cell the facing cells are resolved, each
 * (anomaly, neighbour) pair is recorded, and the classified traffic of all
 * neighbours is pulled from the classified table. Anomalous cells missing from
 * the geometry table are reported in {@link NeighborAnalysis#getUnknownCells()}
 * rather than silently treated as isolated.
 * </p>
 *
 * @since 1.0.0
 */
public class NeighborTrafficAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(NeighborTrafficAggregator.class);

    private final DirectionalNeighborResolver resolver;

    public NeighborTrafficAggregator(DirectionalNeighborResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "Resolver must not be null");
    }

    /**
     * @param classified     classified rows of all cells
     * @param anomalousCells cells selected by the sustained-anomaly filter
     * @param geometry       validated geometry table
     * @return neighbour traffic, anomaly → neighbour mapping and involved
     *         geometry; all empty when {@code anomalousCells} is empty
     */
    public NeighborAnalysis aggregate(List<ClassifiedObservation> classified,
            Collection<String> anomalousCells,
            GeometryTable geometry) {
        Objects.requireNonNull(classified, "Classified observations must not be null");
        Objects.requireNonNull(anomalousCells, "Anomalous cells must not be null");
        Objects.requireNonNull(geometry, "Geometry table must not be null");

        if (anomalousCells.isEmpty()) {
            return NeighborAnalysis.empty();
        }

        List<FacingRelation> relations = new ArrayList<>();
        Set<String> neighborIds = new LinkedHashSet<>();
        Set<String> involvedIds = new LinkedHashSet<>();
        Set<String> unknownCells = new LinkedHashSet<>();

        for (String anomalyCell : anomalousCells) {
            Optional<Set<CellGeometry>> neighbors = resolver.findFacingCells(geometry, anomalyCell);
            if (neighbors.isEmpty()) {
                LOG.warn("Anomalous cell [{}] has no geometry, neighbours cannot be resolved", anomalyCell);
                unknownCells.add(anomalyCell);
                continue;
            }
            involvedIds.add(anomalyCell);
            for (CellGeometry neighbor : neighbors.get()) {
                relations.add(new FacingRelation(anomalyCell, neighbor.getCellId()));
                neighborIds.add(neighbor.getCellId());
                involvedIds.add(neighbor.getCellId());
            }
        }

        List<ClassifiedObservation> neighborTraffic = classified.stream()
                .filter(row -> neighborIds.contains(row.getCellId()))
                .sorted(TrafficObservation.BY_CELL_AND_TIME)
                .toList();

        LOG.info("{} anomalous cell(s) face {} neighbour(s) through {} relation(s)",
                anomalousCells.size() - unknownCells.size(), neighborIds.size(), relations.size());
        return new NeighborAnalysis(neighborTraffic, relations, geometry.restrictTo(involvedIds), unknownCells);
    }

    /**
     * Deduplicated union of two traffic tables, keyed by (cell, timestamp).
     * When both contain a row, the one from {@code anomalyTraffic} is kept.
     *
     * @return rows ordered by cell, then timestamp
     */
    public static List<ClassifiedObservation> combine(List<ClassifiedObservation> anomalyTraffic,
            List<ClassifiedObservation> neighborTraffic) {
        Objects.requireNonNull(anomalyTraffic, "Anomaly traffic must not be null");
        Objects.requireNonNull(neighborTraffic, "Neighbor traffic must not be null");

        Map<Map.Entry<String, LocalDateTime>, ClassifiedObservation> union = new LinkedHashMap<>();
        for (ClassifiedObservation row : anomalyTraffic) {
            union.putIfAbsent(rowKey(row), row);
        }
        for (ClassifiedObservation row : neighborTraffic) {
            union.putIfAbsent(rowKey(row), row);
        }

        List<ClassifiedObservation> combined = new ArrayList<>(union.values());
        combined.sort(TrafficObservation.BY_CELL_AND_TIME);
        return combined;
    }

    private static Map.Entry<String, LocalDateTime> rowKey(ClassifiedObservation row) {
        return new AbstractMap.SimpleImmutableEntry<>(row.getCellId(), row.getDatetime());
    }
}
