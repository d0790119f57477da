package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.Signal;
import com.cellsentinel.core.model.TrafficLabel;
import com.cellsentinel.core.model.TrafficObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies each traffic row against the rolling baseline of its time-of-week
 * slot.
 *
 * <p>
 * Rows are partitioned by {@link TimeOfWeekKey} (cell × weekday × hour) and
 * ordered by timestamp. For every row, the mean and sample standard deviation
 * of the trailing {@code classificationWindow} rows of its partition (itself
 * included) form the baseline, and each signal is labelled:
 * </p>
 * <ul>
 * <li>{@link TrafficLabel#INCREASE} if {@code value > mean + k × σ}</li>
 * <li>{@link TrafficLabel#DEGRADATION} if {@code value < mean − k × σ}</li>
 * <li>{@link TrafficLabel#STABLE} otherwise, and whenever {@code σ == 0}</li>
 * </ul>
 * <p>
 * {@code k} is {@code csMultiplier} for the CS signal and
 * {@code dataMultiplier} for the DATA signal.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This classifier is <strong>stateless</strong> between calls: rolling windows
 * live only for the duration of one {@link #classifyPartition(List)} call, so
 * one instance can classify partitions concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowedAnomalyClassifier implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(WindowedAnomalyClassifier.class);

    private final double csMultiplier;
    private final double dataMultiplier;
    private final int classificationWindow;

    /**
     * @throws IllegalArgumentException if a multiplier is not positive or the
     *                                  window is &lt; 1
     */
    public WindowedAnomalyClassifier(double csMultiplier, double dataMultiplier, int classificationWindow) {
        if (!(csMultiplier > 0)) {
            throw new IllegalArgumentException("csMultiplier must be > 0, got: " + csMultiplier);
        }
        if (!(dataMultiplier > 0)) {
            throw new IllegalArgumentException("dataMultiplier must be > 0, got: " + dataMultiplier);
        }
        if (classificationWindow < 1) {
            throw new IllegalArgumentException(
                    "classificationWindow must be >= 1, got: " + classificationWindow);
        }
        this.csMultiplier = csMultiplier;
        this.dataMultiplier = dataMultiplier;
        this.classificationWindow = classificationWindow;
    }

    public static WindowedAnomalyClassifier from(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        return new WindowedAnomalyClassifier(
                config.getCsMultiplier(), config.getDataMultiplier(), config.getClassificationWindow());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Validate and classify a whole traffic table.
     *
     * @param observations raw rows in any order; must not be {@code null}
     * @return classified rows ordered by cell, then timestamp
     * @throws IllegalStateException if any row is invalid
     */
    public List<ClassifiedObservation> classify(Collection<? extends TrafficObservation> observations) {
        Objects.requireNonNull(observations, "Observations must not be null");

        Map<TimeOfWeekKey, List<TrafficObservation>> partitions = new LinkedHashMap<>();
        for (TrafficObservation observation : observations) {
            Objects.requireNonNull(observation, "Observation must not be null");
            observation.validate();
            partitions.computeIfAbsent(TimeOfWeekKey.of(observation), k -> new ArrayList<>())
                    .add(observation);
        }

        List<ClassifiedObservation> result = new ArrayList<>(observations.size());
        for (List<TrafficObservation> partition : partitions.values()) {
            result.addAll(classifyPartition(partition));
        }
        result.sort(TrafficObservation.BY_CELL_AND_TIME);

        LOG.info("Classified {} observation(s) across {} time-of-week partition(s)",
                result.size(), partitions.size());
        return result;
    }

    /**
     * Classify the rows of a single time-of-week partition.
     *
     * @param partition rows sharing one {@link TimeOfWeekKey}, in any order
     * @return classified rows in timestamp order
     * @throws IllegalArgumentException if the rows span more than one partition
     */
    public List<ClassifiedObservation> classifyPartition(List<? extends TrafficObservation> partition) {
        Objects.requireNonNull(partition, "Partition must not be null");
        if (partition.isEmpty()) {
            return List.of();
        }

        List<TrafficObservation> ordered = new ArrayList<>(partition);
        ordered.sort(Comparator.comparing(TrafficObservation::getDatetime));

        TimeOfWeekKey key = TimeOfWeekKey.of(ordered.get(0));
        RollingWindow csWindow = new RollingWindow(classificationWindow);
        RollingWindow dataWindow = new RollingWindow(classificationWindow);
        List<ClassifiedObservation> classified = new ArrayList<>(ordered.size());

        for (TrafficObservation observation : ordered) {
            if (!key.equals(TimeOfWeekKey.of(observation))) {
                throw new IllegalArgumentException(
                        "Partition " + key + " contains a row of " + TimeOfWeekKey.of(observation));
            }
            ClassifiedObservation row = new ClassifiedObservation(observation);
            apply(row, Signal.CS, csWindow, csMultiplier);
            apply(row, Signal.DATA, dataWindow, dataMultiplier);
            classified.add(row);
        }

        LOG.debug("Partition [{}]: {} row(s) classified", key, classified.size());
        return classified;
    }

    /**
     * Threshold one value against its baseline.
     *
     * <p>
     * Both bounds are exclusive: a value exactly on {@code mean ± k × σ} is
     * {@link TrafficLabel#STABLE}.
     * </p>
     *
     * @param value      measured value
     * @param mean       rolling mean
     * @param stddev     rolling standard deviation; {@code <= 0} or NaN means
     *                   no variance
     * @param multiplier tolerated number of standard deviations
     * @return the label
     */
    public static TrafficLabel label(double value, double mean, double stddev, double multiplier) {
        if (!(stddev > 0)) {
            return TrafficLabel.STABLE;
        }
        double allowedDeviation = multiplier * stddev;
        if (value > mean + allowedDeviation) {
            return TrafficLabel.INCREASE;
        }
        if (value < mean - allowedDeviation) {
            return TrafficLabel.DEGRADATION;
        }
        return TrafficLabel.STABLE;
    }

    public double getCsMultiplier() {
        return csMultiplier;
    }

    public double getDataMultiplier() {
        return dataMultiplier;
    }

    public int getClassificationWindow() {
        return classificationWindow;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void apply(ClassifiedObservation row, Signal signal, RollingWindow window, double multiplier) {
        double value = row.valueOf(signal);
        // The current row is part of its own baseline
        window.add(value);
        double mean = window.mean();
        double stddev = window.stddev();
        row.applyClassification(signal, mean, stddev, label(value, mean, stddev, multiplier));
    }
}
