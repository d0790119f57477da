package com.cellsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything one pipeline run hands to the visualisation layer.
 *
 * <p>
 * {@link #getCombinedTraffic()} is the deduplicated union of the anomalous
 * cells' own history and their neighbours' history.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyReport {

    private final List<ClassifiedObservation> classified;
    private final SustainedAnomalyResult sustained;
    private final NeighborAnalysis neighbors;
    private final List<ClassifiedObservation> combinedTraffic;

    public AnomalyReport(List<ClassifiedObservation> classified,
            SustainedAnomalyResult sustained,
            NeighborAnalysis neighbors,
            List<ClassifiedObservation> combinedTraffic) {
        this.classified = List.copyOf(Objects.requireNonNull(classified, "classified"));
        this.sustained = Objects.requireNonNull(sustained, "sustained");
        this.neighbors = Objects.requireNonNull(neighbors, "neighbors");
        this.combinedTraffic = List.copyOf(Objects.requireNonNull(combinedTraffic, "combinedTraffic"));
    }

    public List<ClassifiedObservation> getClassified() {
        return classified;
    }

    public SustainedAnomalyResult getSustained() {
        return sustained;
    }

    public NeighborAnalysis getNeighbors() {
        return neighbors;
    }

    public List<ClassifiedObservation> getCombinedTraffic() {
        return combinedTraffic;
    }

    @Override
    public String toString() {
        return "AnomalyReport{classifiedRows=" + classified.size()
                + ", sustained=" + sustained
                + ", neighbors=" + neighbors
                + ", combinedRows=" + combinedTraffic.size() + '}';
    }
}
