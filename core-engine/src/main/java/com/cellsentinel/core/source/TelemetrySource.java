package com.cellsentinel.core.source;

import com.cellsentinel.core.model.CellGeometry;
import com.cellsentinel.core.model.TrafficObservation;

import java.util.List;

/**
 * Supplier of the two inputs of an analysis run: preprocessed hourly traffic
 * and antenna geometry.
 *
 * <p>
 * Implementations own their connection or file handles; the core engine only
 * calls these two methods once per run and holds no reference afterwards.
 * </p>
 */
public interface TelemetrySource {

    /**
     * @return traffic rows, one per (cell, hour); never {@code null}
     */
    List<TrafficObservation> loadTraffic();

    /**
     * @return geometry rows, one per cell; never {@code null}
     */
    List<CellGeometry> loadGeometry();
}
