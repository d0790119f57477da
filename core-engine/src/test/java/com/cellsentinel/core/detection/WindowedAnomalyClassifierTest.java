package com.cellsentinel.core.detection;

import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.TrafficLabel;
import com.cellsentinel.core.model.TrafficObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowedAnomalyClassifier}.
 */
class WindowedAnomalyClassifierTest {

    /** A Monday, 10:00. */
    private static final LocalDateTime MONDAY_10 = LocalDateTime.of(2024, 1, 1, 10, 0);

    private WindowedAnomalyClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new WindowedAnomalyClassifier(1.5, 3.0, 5);
    }

    // ------------------------------------------------------------------
    // Threshold
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should label values beyond mean ± k·σ")
    void shouldLabelBeyondBounds() {
        assertThat(WindowedAnomalyClassifier.label(131, 100, 10, 3)).isEqualTo(TrafficLabel.INCREASE);
        assertThat(WindowedAnomalyClassifier.label(69, 100, 10, 3)).isEqualTo(TrafficLabel.DEGRADATION);
        assertThat(WindowedAnomalyClassifier.label(115, 100, 10, 3)).isEqualTo(TrafficLabel.STABLE);
    }

    @Test
    @DisplayName("Should label a value exactly on a bound as STABLE")
    void shouldTreatBoundsAsStable() {
        assertThat(WindowedAnomalyClassifier.label(130, 100, 10, 3)).isEqualTo(TrafficLabel.STABLE);
        assertThat(WindowedAnomalyClassifier.label(70, 100, 10, 3)).isEqualTo(TrafficLabel.STABLE);
    }

    @Test
    @DisplayName("Should label everything STABLE without variance")
    void shouldBeStableWithoutVariance() {
        assertThat(WindowedAnomalyClassifier.label(1_000, 100, 0, 2)).isEqualTo(TrafficLabel.STABLE);
        assertThat(WindowedAnomalyClassifier.label(0, 100, 0, 2)).isEqualTo(TrafficLabel.STABLE);
        assertThat(WindowedAnomalyClassifier.label(1_000, 100, Double.NaN, 2)).isEqualTo(TrafficLabel.STABLE);
    }

    // ------------------------------------------------------------------
    // Rolling baseline
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should flag a spike above the time-of-week baseline as INCREASE")
    void shouldDetectIncrease() {
        List<ClassifiedObservation> result = classifier.classify(
                weekly("A", 100, 110, 90, 100, 300));

        ClassifiedObservation last = result.get(4);
        assertThat(last.getCsRollingMean()).isCloseTo(140.0, within(1e-9));
        assertThat(last.getCsRollingStddev()).isCloseTo(Math.sqrt(8050.0), within(1e-9));
        assertThat(last.getCsLabel()).isEqualTo(TrafficLabel.INCREASE);
    }

    @Test
    @DisplayName("Should flag a drop below the time-of-week baseline as DEGRADATION")
    void shouldDetectDegradation() {
        List<ClassifiedObservation> result = classifier.classify(
                weekly("A", 100, 110, 90, 100, 0));

        assertThat(result.get(4).getCsLabel()).isEqualTo(TrafficLabel.DEGRADATION);
    }

    @Test
    @DisplayName("Should apply the DATA multiplier independently of the CS one")
    void shouldUseIndependentMultipliers() {
        List<TrafficObservation> rows = new ArrayList<>();
        double[] values = { 100, 110, 90, 100, 300 };
        for (int week = 0; week < values.length; week++) {
            rows.add(new TrafficObservation("A", MONDAY_10.plusWeeks(week), values[week], values[week]));
        }

        ClassifiedObservation last = classifier.classify(rows).get(4);

        // k = 1.5 flags the spike, k = 3.0 tolerates it
        assertThat(last.getCsLabel()).isEqualTo(TrafficLabel.INCREASE);
        assertThat(last.getDataLabel()).isEqualTo(TrafficLabel.STABLE);
    }

    @Test
    @DisplayName("Should keep the first row of a partition STABLE")
    void shouldKeepSingleSampleStable() {
        List<ClassifiedObservation> result = classifier.classify(weekly("A", 500));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getCsRollingStddev()).isZero();
        assertThat(result.get(0).getCsLabel()).isEqualTo(TrafficLabel.STABLE);
    }

    @Test
    @DisplayName("Should build separate baselines per weekday and hour")
    void shouldPartitionByTimeOfWeek() {
        List<TrafficObservation> rows = new ArrayList<>();
        for (int week = 0; week < 4; week++) {
            rows.add(new TrafficObservation("A", MONDAY_10.plusWeeks(week), 100, 10));
            rows.add(new TrafficObservation("A", MONDAY_10.plusWeeks(week).plusHours(1), 500, 50));
            rows.add(new TrafficObservation("A", MONDAY_10.plusWeeks(week).plusDays(1), 900, 90));
        }

        List<ClassifiedObservation> result = classifier.classify(rows);

        assertThat(result).hasSize(12);
        assertThat(result).allSatisfy(row -> {
            assertThat(row.getCsRollingStddev()).isZero();
            assertThat(row.getCsRollingMean()).isEqualTo(row.getTrafficCs());
            assertThat(row.isAnomalous()).isFalse();
        });
    }

    @Test
    @DisplayName("Should only use the trailing classification window")
    void shouldRestrictToTrailingWindow() {
        WindowedAnomalyClassifier shortWindow = new WindowedAnomalyClassifier(1.5, 1.5, 2);

        List<ClassifiedObservation> result = shortWindow.classify(weekly("A", 10, 1_000, 1_000));

        ClassifiedObservation last = result.get(2);
        assertThat(last.getCsRollingMean()).isCloseTo(1_000.0, within(1e-9));
        assertThat(last.getCsRollingStddev()).isZero();
        assertThat(last.getCsLabel()).isEqualTo(TrafficLabel.STABLE);
    }

    @Test
    @DisplayName("Should flag a small rise on a large, nearly constant baseline")
    void shouldDetectIncreaseOnLowRelativeVariance() {
        WindowedAnomalyClassifier wideWindow = new WindowedAnomalyClassifier(1.5, 3.0, 24);
        double[] values = new double[24];
        Arrays.fill(values, 1_000_000);
        values[23] = 1_000_001;

        ClassifiedObservation last = wideWindow.classify(weekly("A", values)).get(23);

        assertThat(last.getCsRollingStddev()).isCloseTo(Math.sqrt(1.0 / 24), within(1e-6));
        assertThat(last.getCsLabel()).isEqualTo(TrafficLabel.INCREASE);
    }

    @Test
    @DisplayName("Should return rows ordered by cell, then timestamp")
    void shouldOrderOutput() {
        List<TrafficObservation> rows = new ArrayList<>();
        rows.add(new TrafficObservation("B", MONDAY_10.plusHours(1), 1, 1));
        rows.add(new TrafficObservation("A", MONDAY_10.plusHours(2), 1, 1));
        rows.add(new TrafficObservation("B", MONDAY_10, 1, 1));
        rows.add(new TrafficObservation("A", MONDAY_10, 1, 1));

        List<ClassifiedObservation> result = classifier.classify(rows);

        assertThat(result).extracting(TrafficObservation::getCellId).containsExactly("A", "A", "B", "B");
        assertThat(result.get(0).getDatetime()).isEqualTo(MONDAY_10);
        assertThat(result.get(3).getDatetime()).isEqualTo(MONDAY_10.plusHours(1));
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should fail fast on negative traffic")
    void shouldRejectNegativeTraffic() {
        List<TrafficObservation> rows = List.of(new TrafficObservation("A", MONDAY_10, -1, 0));

        assertThatThrownBy(() -> classifier.classify(rows))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("traffic_cs");
    }

    @Test
    @DisplayName("Should refuse a partition mixing time-of-week slots")
    void shouldRejectMixedPartition() {
        List<TrafficObservation> rows = List.of(
                new TrafficObservation("A", MONDAY_10, 1, 1),
                new TrafficObservation("A", MONDAY_10.plusHours(1), 1, 1));

        assertThatThrownBy(() -> classifier.classifyPartition(rows))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Partition");
    }

    @Test
    @DisplayName("Should reject non-positive multipliers and windows")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new WindowedAnomalyClassifier(0, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("csMultiplier");
        assertThatThrownBy(() -> new WindowedAnomalyClassifier(1, 1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("classificationWindow");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Rows for {@code cellId} in consecutive weeks at the same weekday and hour,
     * CS traffic taken from {@code csValues}, constant DATA traffic.
     */
    private static List<TrafficObservation> weekly(String cellId, double... csValues) {
        List<TrafficObservation> rows = new ArrayList<>();
        for (int week = 0; week < csValues.length; week++) {
            rows.add(new TrafficObservation(cellId, MONDAY_10.plusWeeks(week), csValues[week], 50));
        }
        return rows;
    }
}
