package com.cellsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Output of the sustained-anomaly filter.
 *
 * <p>
 * {@link #getAnomalyTraffic()} holds the <strong>complete</strong> classified
 * history of every qualifying cell, not only the anomalous slots, so that
 * downstream consumers can plot each anomaly in context.
 * </p>
 *
 * @since 1.0.0
 */
public final class SustainedAnomalyResult {

    private final List<SustainedAnomaly> anomalies;
    private final Set<String> anomalousCells;
    private final List<ClassifiedObservation> anomalyTraffic;

    public SustainedAnomalyResult(List<SustainedAnomaly> anomalies,
            List<ClassifiedObservation> anomalyTraffic) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(anomalyTraffic, "anomalyTraffic must not be null");
        this.anomalies = List.copyOf(anomalies);
        Set<String> cells = new LinkedHashSet<>();
        anomalies.forEach(a -> cells.add(a.getCellId()));
        this.anomalousCells = Collections.unmodifiableSet(cells);
        this.anomalyTraffic = List.copyOf(anomalyTraffic);
    }

    /**
     * @return an empty result with typed, empty tables
     */
    public static SustainedAnomalyResult empty() {
        return new SustainedAnomalyResult(List.of(), List.of());
    }

    public List<SustainedAnomaly> getAnomalies() {
        return anomalies;
    }

    /**
     * @return unmodifiable set of qualifying cell ids, in detection order
     */
    public Set<String> getAnomalousCells() {
        return anomalousCells;
    }

    public List<ClassifiedObservation> getAnomalyTraffic() {
        return anomalyTraffic;
    }

    public boolean isEmpty() {
        return anomalies.isEmpty();
    }

    @Override
    public String toString() {
        return "SustainedAnomalyResult{cells=" + anomalousCells
                + ", trafficRows=" + anomalyTraffic.size() + '}';
    }
}
