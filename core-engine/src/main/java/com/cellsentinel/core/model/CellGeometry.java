package com.cellsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static antenna metadata for one cell.
 *
 * <p>
 * {@code siteId} groups cells mounted on the same physical site.
 * {@code azimuth} is the compass direction (degrees from true north) the main
 * lobe points to, and {@code maxDistanceKm} is the farthest distance at which
 * another cell is still considered a neighbour; it may vary per province.
 * </p>
 *
 * <p>
 * Call {@link #validate()} before using a row for bearing computations:
 * out-of-range coordinates or azimuths would otherwise produce degenerate
 * bearings silently.
 * </p>
 *
 * @since 1.0.0
 */
public class CellGeometry implements Serializable {

    private static final long serialVersionUID = 1L;

    private String cellId;
    private String siteId;
    private double latitude;
    private double longitude;
    private double azimuth;
    private double maxDistanceKm;

    public CellGeometry() {
    }

    public CellGeometry(String cellId, String siteId, double latitude, double longitude,
            double azimuth, double maxDistanceKm) {
        this.cellId = cellId;
        this.siteId = siteId;
        this.latitude = latitude;
        this.longitude = longitude;
        this.azimuth = azimuth;
        this.maxDistanceKm = maxDistanceKm;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate identifiers, coordinate ranges, azimuth and distance.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (cellId == null || cellId.isBlank()) {
            errors.add("'cell_id' is required");
        }
        if (siteId == null || siteId.isBlank()) {
            errors.add("'site_id' is required");
        }
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            errors.add("'latitude' must be in [-90, 90], got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            errors.add("'longitude' must be in [-180, 180], got: " + longitude);
        }
        if (!Double.isFinite(azimuth) || azimuth < 0 || azimuth >= 360) {
            errors.add("'azimuth' must be in [0, 360), got: " + azimuth);
        }
        if (!Double.isFinite(maxDistanceKm) || maxDistanceKm <= 0) {
            errors.add("'max_distance_km' must be a finite value > 0, got: " + maxDistanceKm);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid CellGeometry '" + cellId + "': " + String.join("; ", errors));
        }
    }

    /**
     * @return {@code true} if {@code other} is mounted on the same site
     */
    public boolean isSameSite(CellGeometry other) {
        return siteId != null && siteId.equals(other.siteId);
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

    public String getSiteId() {
        return siteId;
    }

    public void setSiteId(String siteId) {
        this.siteId = siteId;
    }

    public double getLatitude() {
        return latitude;
    }

    public void setLatitude(double latitude) {
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public void setLongitude(double longitude) {
        this.longitude = longitude;
    }

    public double getAzimuth() {
        return azimuth;
    }

    public void setAzimuth(double azimuth) {
        this.azimuth = azimuth;
    }

    public double getMaxDistanceKm() {
        return maxDistanceKm;
    }

    public void setMaxDistanceKm(double maxDistanceKm) {
        this.maxDistanceKm = maxDistanceKm;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellGeometry that))
            return false;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Double.compare(azimuth, that.azimuth) == 0
                && Double.compare(maxDistanceKm, that.maxDistanceKm) == 0
                && Objects.equals(cellId, that.cellId)
                && Objects.equals(siteId, that.siteId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, siteId, latitude, longitude, azimuth, maxDistanceKm);
    }

    @Override
    public String toString() {
        return "CellGeometry{" +
                "cellId='" + cellId + '\'' +
                ", siteId='" + siteId + '\'' +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", azimuth=" + azimuth +
                ", maxDistanceKm=" + maxDistanceKm +
                '}';
    }
}
