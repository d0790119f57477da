package com.cellsentinel.core.detection;

import com.cellsentinel.core.model.TrafficObservation;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * Partition key of the rolling baseline: (cell, weekday, hour of day).
 *
 * <p>
 * Rows sharing a key are the same slot of the week in different calendar
 * weeks, so their statistics describe the usual traffic for that slot.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeOfWeekKey {

    private final String cellId;
    private final DayOfWeek dayOfWeek;
    private final int hour;

    public TimeOfWeekKey(String cellId, DayOfWeek dayOfWeek, int hour) {
        this.cellId = Objects.requireNonNull(cellId, "cellId must not be null");
        this.dayOfWeek = Objects.requireNonNull(dayOfWeek, "dayOfWeek must not be null");
        this.hour = hour;
    }

    /**
     * @param observation a row with cell id and timestamp set
     * @return the partition key of that row
     */
    public static TimeOfWeekKey of(TrafficObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(observation.getDatetime(), "Observation datetime must not be null");
        return new TimeOfWeekKey(observation.getCellId(),
                observation.getDatetime().getDayOfWeek(),
                observation.getDatetime().getHour());
    }

    /**
     * Flat string form, usable as a Flink key.
     *
     * @return {@code cellId|DAY|hour}
     */
    public String asString() {
        return cellId + '|' + dayOfWeek + '|' + hour;
    }

    public String getCellId() {
        return cellId;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public int getHour() {
        return hour;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeOfWeekKey that))
            return false;
        return hour == that.hour && cellId.equals(that.cellId) && dayOfWeek == that.dayOfWeek;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, dayOfWeek, hour);
    }

    @Override
    public String toString() {
        return asString();
    }
}
