package com.cellsentinel.core.source;

import com.cellsentinel.core.model.CellGeometry;
import com.cellsentinel.core.model.TrafficObservation;

import java.util.List;
import java.util.Objects;

/**
 * {@link TelemetrySource} backed by lists that are already in memory.
 *
 * @since 1.0.0
 */
public final class InMemoryTelemetrySource implements TelemetrySource {

    private final List<TrafficObservation> traffic;
    private final List<CellGeometry> geometry;

    public InMemoryTelemetrySource(List<TrafficObservation> traffic, List<CellGeometry> geometry) {
        this.traffic = List.copyOf(Objects.requireNonNull(traffic, "Traffic rows must not be null"));
        this.geometry = List.copyOf(Objects.requireNonNull(geometry, "Geometry rows must not be null"));
    }

    @Override
    public List<TrafficObservation> loadTraffic() {
        return traffic;
    }

    @Override
    public List<CellGeometry> loadGeometry() {
        return geometry;
    }
}
