package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Directed pair linking an anomalous cell to one of the cells facing it.
 *
 * @since 1.0.0
 */
public class FacingRelation implements Serializable {

    private static final long serialVersionUID = 1L;

    private String anomalyCell;
    private String neighborCell;

    /** No-arg constructor required by Jackson and Flink. */
    public FacingRelation() {
    }

    public FacingRelation(String anomalyCell, String neighborCell) {
        this.anomalyCell = Objects.requireNonNull(anomalyCell, "anomalyCell must not be null");
        this.neighborCell = Objects.requireNonNull(neighborCell, "neighborCell must not be null");
    }

    public String getAnomalyCell() {
        return anomalyCell;
    }

    public void setAnomalyCell(String anomalyCell) {
        this.anomalyCell = anomalyCell;
    }

    public String getNeighborCell() {
        return neighborCell;
    }

    public void setNeighborCell(String neighborCell) {
        this.neighborCell = neighborCell;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FacingRelation that))
            return false;
        return Objects.equals(anomalyCell, that.anomalyCell)
                && Objects.equals(neighborCell, that.neighborCell);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyCell, neighborCell);
    }

    @Override
    public String toString() {
        return anomalyCell + " -> " + neighborCell;
    }
}
