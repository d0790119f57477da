package com.cellsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A cell whose count of anomalous slots within the trailing evaluation horizon
 * reached the configured minimum.
 *
 * <p>
 * The CS and DATA signals are counted independently;
 * {@link #isCsSustained()} and {@link #isDataSustained()} tell which of them
 * crossed the threshold. At least one of them is always {@code true}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code cellId}, {@code windowStart} and
 * {@code windowEnd} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class SustainedAnomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private String cellId;

    /** Exclusive lower bound of the evaluation horizon. */
    private LocalDateTime windowStart;

    /** Latest timestamp in the evaluated data set. */
    private LocalDateTime windowEnd;

    /** Highest trailing count of anomalous CS slots seen in the horizon. */
    private int peakCsCount;

    /** Highest trailing count of anomalous DATA slots seen in the horizon. */
    private int peakDataCount;

    private boolean csSustained;
    private boolean dataSustained;

    /** No-arg constructor required by Jackson. */
    public SustainedAnomaly() {
    }

    private SustainedAnomaly(Builder builder) {
        this.cellId = Objects.requireNonNull(builder.cellId, "cellId must not be null");
        this.windowStart = Objects.requireNonNull(builder.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(builder.windowEnd, "windowEnd must not be null");
        this.peakCsCount = builder.peakCsCount;
        this.peakDataCount = builder.peakDataCount;
        this.csSustained = builder.csSustained;
        this.dataSustained = builder.dataSustained;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SustainedAnomaly} instances.
     */
    public static class Builder {
        private String cellId;
        private LocalDateTime windowStart;
        private LocalDateTime windowEnd;
        private int peakCsCount;
        private int peakDataCount;
        private boolean csSustained;
        private boolean dataSustained;

        public Builder cellId(String cellId) {
            this.cellId = cellId;
            return this;
        }

        public Builder windowStart(LocalDateTime windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(LocalDateTime windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder peakCsCount(int peakCsCount) {
            this.peakCsCount = peakCsCount;
            return this;
        }

        public Builder peakDataCount(int peakDataCount) {
            this.peakDataCount = peakDataCount;
            return this;
        }

        public Builder csSustained(boolean csSustained) {
            this.csSustained = csSustained;
            return this;
        }

        public Builder dataSustained(boolean dataSustained) {
            this.dataSustained = dataSustained;
            return this;
        }

        public SustainedAnomaly build() {
            return new SustainedAnomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getCellId() {
        return cellId;
    }

    public void setCellId(String cellId) {
        this.cellId = cellId;
    }

    public LocalDateTime getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(LocalDateTime windowStart) {
        this.windowStart = windowStart;
    }

    public LocalDateTime getWindowEnd() {
        return windowEnd;
    }

    public void setWindowEnd(LocalDateTime windowEnd) {
        this.windowEnd = windowEnd;
    }

    public int getPeakCsCount() {
        return peakCsCount;
    }

    public void setPeakCsCount(int peakCsCount) {
        this.peakCsCount = peakCsCount;
    }

    public int getPeakDataCount() {
        return peakDataCount;
    }

    public void setPeakDataCount(int peakDataCount) {
        this.peakDataCount = peakDataCount;
    }

    public boolean isCsSustained() {
        return csSustained;
    }

    public void setCsSustained(boolean csSustained) {
        this.csSustained = csSustained;
    }

    public boolean isDataSustained() {
        return dataSustained;
    }

    public void setDataSustained(boolean dataSustained) {
        this.dataSustained = dataSustained;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SustainedAnomaly that))
            return false;
        return Objects.equals(cellId, that.cellId)
                && Objects.equals(windowStart, that.windowStart)
                && Objects.equals(windowEnd, that.windowEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, windowStart, windowEnd);
    }

    @Override
    public String toString() {
        return "SustainedAnomaly{" +
                "cellId='" + cellId + '\'' +
                ", windowStart=" + windowStart +
                ", windowEnd=" + windowEnd +
                ", peakCsCount=" + peakCsCount +
                ", peakDataCount=" + peakDataCount +
                ", csSustained=" + csSustained +
                ", dataSustained=" + dataSustained +
                '}';
    }
}
