package com.cellsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One hourly telemetry sample for a single cell.
 *
 * <p>
 * Carries the circuit-switched ({@code trafficCs}) and data
 * ({@code trafficData}) volumes measured at {@code datetime}. The timestamp is
 * the network's local wall-clock time, since the weekday and hour of day drive
 * the classification baseline.
 * </p>
 *
 * <p>
 * Kept as a plain POJO (public no-arg constructor and accessors) so Flink can
 * serialize it without falling back to Kryo. Call {@link #validate()} before
 * feeding rows into the classifier.
 * </p>
 *
 * @since 1.0.0
 */
public class TrafficObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Output order of every traffic table: by cell, then by timestamp. */
    public static final Comparator<TrafficObservation> BY_CELL_AND_TIME = Comparator
            .comparing(TrafficObservation::getCellId)
            .thenComparing(TrafficObservation::getDatetime);

    private String cellId;

    private LocalDateTime datetime;

    /** Circuit-switched traffic volume. */
    private double trafficCs;

    /** Packet data traffic volume. */
    private double trafficData;

    public TrafficObservation() {
    }

    public TrafficObservation(String cellId, LocalDateTime datetime, double trafficCs, double trafficData) {
        this.cellId = cellId;
        this.datetime = datetime;
        this.trafficCs = trafficCs;
        this.trafficData = trafficData;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that the row is usable by the classifier.
     *
     * @throws IllegalStateException if the cell id is blank, the timestamp is
     *                               missing, or a volume is negative or not finite
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (cellId == null || cellId.isBlank()) {
            errors.add("'cell_id' is required");
        }
        if (datetime == null) {
            errors.add("'datetime' is required");
        }
        if (!Double.isFinite(trafficCs) || trafficCs < 0) {
            errors.add("'traffic_cs' must be a finite value >= 0, got: " + trafficCs);
        }
        if (!Double.isFinite(trafficData) || trafficData < 0) {
            errors.add("'traffic_data' must be a finite value >= 0, got: " + trafficData);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid TrafficObservation for cell '" + cellId + "' at " + datetime + ": "
                            + String.join("; ", errors));
        }
    }

    /**
     * @param signal which traffic signal to read
     * @return the measured volume of that signal
     */
    public double valueOf(Signal signal) {
        return switch (signal) {
            case CS -> trafficCs;
            case DATA -> trafficData;
        };
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getCellId() {
        return cellId;
    }

    public void setCellId(String cellId) {
        this.cellId = cellId;
    }

    public LocalDateTime getDatetime() {
        return datetime;
    }

    public void setDatetime(LocalDateTime datetime) {
        this.datetime = datetime;
    }

    public double getTrafficCs() {
        return trafficCs;
    }

    public void setTrafficCs(double trafficCs) {
        this.trafficCs = trafficCs;
    }

    public double getTrafficData() {
        return trafficData;
    }

    public void setTrafficData(double trafficData) {
        this.trafficData = trafficData;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        TrafficObservation that = (TrafficObservation) o;
        return Double.compare(trafficCs, that.trafficCs) == 0
                && Double.compare(trafficData, that.trafficData) == 0
                && Objects.equals(cellId, that.cellId)
                && Objects.equals(datetime, that.datetime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, datetime, trafficCs, trafficData);
    }

    @Override
    public String toString() {
        return "TrafficObservation{" +
                "cellId='" + cellId + '\'' +
                ", datetime=" + datetime +
                ", trafficCs=" + trafficCs +
                ", trafficData=" + trafficData +
                '}';
    }
}
