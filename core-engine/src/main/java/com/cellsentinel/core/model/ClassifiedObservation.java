package com.cellsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A {@link TrafficObservation} annotated with its time-of-week rolling
 * statistics and a {@link TrafficLabel} per signal.
 *
 * <p>
 * The rolling mean and standard deviation of a row are computed only from rows
 * of the same cell, same weekday and same hour of day, restricted to the
 * trailing classification window (the row itself included).
 * </p>
 *
 * @since 1.0.0
 */
public class ClassifiedObservation extends TrafficObservation {

    private static final long serialVersionUID = 1L;

    private double csRollingMean;
    private double csRollingStddev;
    private TrafficLabel csLabel = TrafficLabel.STABLE;

    private double dataRollingMean;
    private double dataRollingStddev;
    private TrafficLabel dataLabel = TrafficLabel.STABLE;

    public ClassifiedObservation() {
    }

    /**
     * Copy the raw measurement of {@code source}; statistics and labels are
     * filled in by the classifier.
     *
     * @param source the raw observation; must not be {@code null}
     */
    public ClassifiedObservation(TrafficObservation source) {
        super(Objects.requireNonNull(source, "Source observation must not be null").getCellId(),
                source.getDatetime(), source.getTrafficCs(), source.getTrafficData());
    }

    // ---------------------------------------------------------------
    // Signal-indexed accessors
    // ---------------------------------------------------------------

    public TrafficLabel labelOf(Signal signal) {
        return switch (signal) {
            case CS -> csLabel;
            case DATA -> dataLabel;
        };
    }

    public double rollingMeanOf(Signal signal) {
        return switch (signal) {
            case CS -> csRollingMean;
            case DATA -> dataRollingMean;
        };
    }

    public double rollingStddevOf(Signal signal) {
        return switch (signal) {
            case CS -> csRollingStddev;
            case DATA -> dataRollingStddev;
        };
    }

    /**
     * Record the statistics and label of one signal.
     */
    public void applyClassification(Signal signal, double mean, double stddev, TrafficLabel label) {
        Objects.requireNonNull(label, "Label must not be null");
        switch (signal) {
            case CS -> {
                this.csRollingMean = mean;
                this.csRollingStddev = stddev;
                this.csLabel = label;
            }
            case DATA -> {
                this.dataRollingMean = mean;
                this.dataRollingStddev = stddev;
                this.dataLabel = label;
            }
        }
    }

    /**
     * @return {@code true} if either signal is not {@link TrafficLabel#STABLE}
     */
    @JsonIgnore
    public boolean isAnomalous() {
        return csLabel != TrafficLabel.STABLE || dataLabel != TrafficLabel.STABLE;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getCsRollingMean() {
        return csRollingMean;
    }

    public void setCsRollingMean(double csRollingMean) {
        this.csRollingMean = csRollingMean;
    }

    public double getCsRollingStddev() {
        return csRollingStddev;
    }

    public void setCsRollingStddev(double csRollingStddev) {
        this.csRollingStddev = csRollingStddev;
    }

    public TrafficLabel getCsLabel() {
        return csLabel;
    }

    public void setCsLabel(TrafficLabel csLabel) {
        this.csLabel = csLabel;
    }

    public double getDataRollingMean() {
        return dataRollingMean;
    }

    public void setDataRollingMean(double dataRollingMean) {
        this.dataRollingMean = dataRollingMean;
    }

    public double getDataRollingStddev() {
        return dataRollingStddev;
    }

    public void setDataRollingStddev(double dataRollingStddev) {
        this.dataRollingStddev = dataRollingStddev;
    }

    public TrafficLabel getDataLabel() {
        return dataLabel;
    }

    public void setDataLabel(TrafficLabel dataLabel) {
        this.dataLabel = dataLabel;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!super.equals(o))
            return false;
        ClassifiedObservation that = (ClassifiedObservation) o;
        return Double.compare(csRollingMean, that.csRollingMean) == 0
                && Double.compare(csRollingStddev, that.csRollingStddev) == 0
                && Double.compare(dataRollingMean, that.dataRollingMean) == 0
                && Double.compare(dataRollingStddev, that.dataRollingStddev) == 0
                && csLabel == that.csLabel
                && dataLabel == that.dataLabel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), csLabel, dataLabel);
    }

    @Override
    public String toString() {
        return "ClassifiedObservation{" +
                "cellId='" + getCellId() + '\'' +
                ", datetime=" + getDatetime() +
                ", trafficCs=" + getTrafficCs() +
                ", csMean=" + csRollingMean +
                ", csStddev=" + csRollingStddev +
                ", csLabel=" + csLabel +
                ", trafficData=" + getTrafficData() +
                ", dataMean=" + dataRollingMean +
                ", dataStddev=" + dataRollingStddev +
                ", dataLabel=" + dataLabel +
                '}';
    }
}
