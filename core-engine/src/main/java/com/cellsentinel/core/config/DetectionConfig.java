package com.cellsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of one anomaly analysis run.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * csMultiplier: 2.0
 * dataMultiplier: 2.0
 * classificationWindow: 4
 * anomalyWindowHours: 24
 * minAnomalies: 3
 * halfBeamwidth: 60
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Classification ---
    /** Number of standard deviations tolerated on the CS signal. */
    private double csMultiplier = 2.0;

    /** Number of standard deviations tolerated on the DATA signal. */
    private double dataMultiplier = 2.0;

    /** Count of trailing same-time-of-week samples in the rolling baseline. */
    private int classificationWindow = 4;

    // --- Sustained anomaly ---
    /** Trailing horizon, in hours, over which anomalous slots are counted. */
    private int anomalyWindowHours = 24;

    /** Anomalous slots needed inside the horizon for a cell to qualify. */
    private int minAnomalies = 3;

    // --- Neighbours ---
    /** Half opening of the antenna coverage cone, in degrees. */
    private double halfBeamwidth = 60.0;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every parameter holds a legal value.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(csMultiplier > 0)) {
            errors.add("'csMultiplier' must be > 0, got: " + csMultiplier);
        }
        if (!(dataMultiplier > 0)) {
            errors.add("'dataMultiplier' must be > 0, got: " + dataMultiplier);
        }
        if (classificationWindow < 1) {
            errors.add("'classificationWindow' must be >= 1, got: " + classificationWindow);
        }
        if (anomalyWindowHours < 1) {
            errors.add("'anomalyWindowHours' must be >= 1, got: " + anomalyWindowHours);
        }
        if (minAnomalies < 1) {
            errors.add("'minAnomalies' must be >= 1, got: " + minAnomalies);
        }
        if (!(halfBeamwidth > 0 && halfBeamwidth <= 180)) {
            errors.add("'halfBeamwidth' must be in (0, 180], got: " + halfBeamwidth);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getCsMultiplier() {
        return csMultiplier;
    }

    public void setCsMultiplier(double csMultiplier) {
        this.csMultiplier = csMultiplier;
    }

    public double getDataMultiplier() {
        return dataMultiplier;
    }

    public void setDataMultiplier(double dataMultiplier) {
        this.dataMultiplier = dataMultiplier;
    }

    public int getClassificationWindow() {
        return classificationWindow;
    }

    public void setClassificationWindow(int classificationWindow) {
        this.classificationWindow = classificationWindow;
    }

    public int getAnomalyWindowHours() {
        return anomalyWindowHours;
    }

    public void setAnomalyWindowHours(int anomalyWindowHours) {
        this.anomalyWindowHours = anomalyWindowHours;
    }

    public int getMinAnomalies() {
        return minAnomalies;
    }

    public void setMinAnomalies(int minAnomalies) {
        this.minAnomalies = minAnomalies;
    }

    public double getHalfBeamwidth() {
        return halfBeamwidth;
    }

    public void setHalfBeamwidth(double halfBeamwidth) {
        this.halfBeamwidth = halfBeamwidth;
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "csMultiplier=" + csMultiplier +
                ", dataMultiplier=" + dataMultiplier +
                ", classificationWindow=" + classificationWindow +
                ", anomalyWindowHours=" + anomalyWindowHours +
                ", minAnomalies=" + minAnomalies +
                ", halfBeamwidth=" + halfBeamwidth +
                '}';
    }
}
