package com.cellsentinel.core.source;

import com.cellsentinel.core.model.CellGeometry;
import com.cellsentinel.core.model.TrafficObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryTelemetrySource}.
 */
class InMemoryTelemetrySourceTest {

    @Test
    @DisplayName("Should return a snapshot of the rows it was built with")
    void shouldSnapshotRows() {
        List<TrafficObservation> traffic = new ArrayList<>();
        traffic.add(new TrafficObservation("A", LocalDateTime.of(2024, 1, 1, 0, 0), 1, 1));
        CellGeometry geometry = new CellGeometry("A", "S1", 40.0, -3.0, 90, 5);

        InMemoryTelemetrySource source = new InMemoryTelemetrySource(traffic, List.of(geometry));
        traffic.clear();

        assertThat(source.loadTraffic()).hasSize(1);
        assertThat(source.loadGeometry()).containsExactly(geometry);
    }

    @Test
    @DisplayName("Should reject null inputs")
    void shouldRejectNull() {
        assertThatThrownBy(() -> new InMemoryTelemetrySource(null, List.of()))
                .isInstanceOf(NullPointerException.class);
    }
}
