package com.cellsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Neighbour context attached to a set of anomalous cells.
 *
 * <ul>
 * <li>{@code neighborTraffic}: classified rows of every cell facing an
 * anomalous cell</li>
 * <li>{@code relations}: the anomaly → neighbour mapping</li>
 * <li>{@code involvedGeometry}: deduplicated geometry of anomalies and
 * neighbours</li>
 * <li>{@code unknownCells}: anomalous cells absent from the geometry table,
 * kept apart from cells that simply have no neighbour</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class NeighborAnalysis {

    private final List<ClassifiedObservation> neighborTraffic;
    private final List<FacingRelation> relations;
    private final List<CellGeometry> involvedGeometry;
    private final Set<String> unknownCells;

    public NeighborAnalysis(List<ClassifiedObservation> neighborTraffic,
            List<FacingRelation> relations,
            List<CellGeometry> involvedGeometry,
            Set<String> unknownCells) {
        this.neighborTraffic = List.copyOf(Objects.requireNonNull(neighborTraffic, "neighborTraffic"));
        this.relations = List.copyOf(Objects.requireNonNull(relations, "relations"));
        this.involvedGeometry = List.copyOf(Objects.requireNonNull(involvedGeometry, "involvedGeometry"));
        this.unknownCells = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(unknownCells, "unknownCells")));
    }

    public static NeighborAnalysis empty() {
        return new NeighborAnalysis(List.of(), List.of(), List.of(), Set.of());
    }

    public List<ClassifiedObservation> getNeighborTraffic() {
        return neighborTraffic;
    }

    public List<FacingRelation> getRelations() {
        return relations;
    }

    public List<CellGeometry> getInvolvedGeometry() {
        return involvedGeometry;
    }

    public Set<String> getUnknownCells() {
        return unknownCells;
    }

    @Override
    public String toString() {
        return "NeighborAnalysis{relations=" + relations.size()
                + ", neighborRows=" + neighborTraffic.size()
                + ", involvedCells=" + involvedGeometry.size()
                + ", unknownCells=" + unknownCells + '}';
    }
}
