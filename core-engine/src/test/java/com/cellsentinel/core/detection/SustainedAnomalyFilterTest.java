package com.cellsentinel.core.detection;

import com.cellsentinel.core.config.DetectionConfig;
import com.cellsentinel.core.model.ClassifiedObservation;
import com.cellsentinel.core.model.SustainedAnomaly;
import com.cellsentinel.core.model.SustainedAnomalyResult;
import com.cellsentinel.core.model.TrafficLabel;
import com.cellsentinel.core.model.TrafficObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SustainedAnomalyFilter}.
 */
class SustainedAnomalyFilterTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 4, 0, 0);

    @Test
    @DisplayName("Should qualify a cell at exactly minAnomalies flagged slots")
    void shouldQualifyAtThreshold() {
        List<ClassifiedObservation> rows = hourly("A", 24, Set.of(5, 12, 20), Set.of());

        SustainedAnomalyResult atThreshold = new SustainedAnomalyFilter(24, 3).select(rows);
        SustainedAnomalyResult aboveThreshold = new SustainedAnomalyFilter(24, 4).select(rows);

        assertThat(atThreshold.getAnomalousCells()).containsExactly("A");
        assertThat(atThreshold.getAnomalies().get(0).getPeakCsCount()).isEqualTo(3);
        assertThat(aboveThreshold.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should ignore anomalies older than the horizon")
    void shouldIgnoreRowsBeforeHorizon() {
        // 48 hourly rows, horizon keeps hours 24..47
        List<ClassifiedObservation> rows = hourly("A", 48, Set.of(0, 1, 2, 23), Set.of());

        SustainedAnomalyResult result = new SustainedAnomalyFilter(24, 1).select(rows);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getAnomalyTraffic()).isEmpty();
    }

    @Test
    @DisplayName("Should anchor the horizon on the latest timestamp of the whole table")
    void shouldUseGlobalHorizon() {
        List<ClassifiedObservation> rows = new ArrayList<>();
        rows.addAll(hourly("A", 48, Set.of(), Set.of()));
        // B stops reporting early; its anomalies fall before the global horizon
        rows.addAll(hourly("B", 20, Set.of(17, 18, 19), Set.of()));

        SustainedAnomalyResult result = new SustainedAnomalyFilter(24, 3).select(rows);

        assertThat(result.getAnomalousCells()).isEmpty();
    }

    @Test
    @DisplayName("Should qualify a cell on the DATA signal alone")
    void shouldQualifyOnDataOnly() {
        List<ClassifiedObservation> rows = hourly("A", 24, Set.of(), Set.of(21, 22, 23));

        SustainedAnomalyResult result = new SustainedAnomalyFilter(24, 3).select(rows);

        assertThat(result.getAnomalies()).hasSize(1);
        SustainedAnomaly anomaly = result.getAnomalies().get(0);
        assertThat(anomaly.isDataSustained()).isTrue();
        assertThat(anomaly.isCsSustained()).isFalse();
        assertThat(anomaly.getPeakDataCount()).isEqualTo(3);
        assertThat(anomaly.getPeakCsCount()).isZero();
    }

    @Test
    @DisplayName("Should not add CS and DATA flags together")
    void shouldCountSignalsSeparately() {
        List<ClassifiedObservation> rows = hourly("A", 24, Set.of(20, 21), Set.of(22, 23));

        SustainedAnomalyResult result = new SustainedAnomalyFilter(24, 3).select(rows);

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should return the complete history of qualifying cells only")
    void shouldReturnFullHistory() {
        List<ClassifiedObservation> rows = new ArrayList<>();
        rows.addAll(hourly("B", 48, Set.of(), Set.of()));
        rows.addAll(hourly("A", 48, Set.of(40), Set.of()));

        SustainedAnomalyResult result = new SustainedAnomalyFilter(12, 1).select(rows);

        assertThat(result.getAnomalousCells()).containsExactly("A");
        assertThat(result.getAnomalyTraffic())
                .hasSize(48)
                .allSatisfy(row -> assertThat(row.getCellId()).isEqualTo("A"));
        assertThat(result.getAnomalyTraffic().get(0).getDatetime()).isEqualTo(START);
        assertThat(result.getAnomalyTraffic()).isSortedAccordingTo(TrafficObservation.BY_CELL_AND_TIME);
    }

    @Test
    @DisplayName("Should report the evaluated horizon on each anomaly")
    void shouldReportWindowBounds() {
        List<ClassifiedObservation> rows = hourly("A", 30, Set.of(29), Set.of());

        SustainedAnomaly anomaly = new SustainedAnomalyFilter(24, 1).select(rows).getAnomalies().get(0);

        assertThat(anomaly.getWindowEnd()).isEqualTo(START.plusHours(29));
        assertThat(anomaly.getWindowStart()).isEqualTo(START.plusHours(5));
    }

    @Test
    @DisplayName("Should sort anomalies by cell id")
    void shouldSortAnomalies() {
        List<ClassifiedObservation> rows = new ArrayList<>();
        rows.addAll(hourly("C", 10, Set.of(9), Set.of()));
        rows.addAll(hourly("A", 10, Set.of(9), Set.of()));

        SustainedAnomalyResult result = new SustainedAnomalyFilter(6, 1).select(rows);

        assertThat(result.getAnomalies()).extracting(SustainedAnomaly::getCellId).containsExactly("A", "C");
    }

    @Test
    @DisplayName("Should count the trailing window in rows, not in hours")
    void shouldUseRowBasedTrailingWindow() {
        // Half-hourly rows: the 2h horizon holds 4 rows, the trailing window only 2
        List<ClassifiedObservation> rows = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            TrafficLabel label = (i == 4 || i == 7) ? TrafficLabel.INCREASE : TrafficLabel.STABLE;
            rows.add(row("A", START.plusMinutes(30L * i), label, TrafficLabel.STABLE));
        }

        assertThat(new SustainedAnomalyFilter(2, 2).select(rows).isEmpty()).isTrue();
        assertThat(new SustainedAnomalyFilter(2, 1).select(rows).getAnomalousCells()).containsExactly("A");
    }

    @Test
    @DisplayName("Should return empty tables for empty input")
    void shouldHandleEmptyInput() {
        SustainedAnomalyResult result = new SustainedAnomalyFilter(24, 3).select(List.of());

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getAnomalousCells()).isEmpty();
        assertThat(result.getAnomalyTraffic()).isEmpty();
    }

    @Test
    @DisplayName("Should build from a DetectionConfig")
    void shouldBuildFromConfig() {
        DetectionConfig config = new DetectionConfig();
        config.setAnomalyWindowHours(12);
        config.setMinAnomalies(2);

        SustainedAnomalyFilter filter = SustainedAnomalyFilter.from(config);

        assertThat(filter.getAnomalyWindowHours()).isEqualTo(12);
        assertThat(filter.getMinAnomalies()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject non-positive parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new SustainedAnomalyFilter(0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anomalyWindowHours");
        assertThatThrownBy(() -> new SustainedAnomalyFilter(1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minAnomalies");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * {@code hours} consecutive hourly rows for {@code cellId}; the listed hour
     * offsets carry an INCREASE label on CS, respectively a DEGRADATION label
     * on DATA.
     */
    private static List<ClassifiedObservation> hourly(String cellId, int hours,
            Set<Integer> csFlagged, Set<Integer> dataFlagged) {
        List<ClassifiedObservation> rows = new ArrayList<>();
        for (int h = 0; h < hours; h++) {
            rows.add(row(cellId, START.plusHours(h),
                    csFlagged.contains(h) ? TrafficLabel.INCREASE : TrafficLabel.STABLE,
                    dataFlagged.contains(h) ? TrafficLabel.DEGRADATION : TrafficLabel.STABLE));
        }
        return rows;
    }

    private static ClassifiedObservation row(String cellId, LocalDateTime datetime,
            TrafficLabel csLabel, TrafficLabel dataLabel) {
        ClassifiedObservation row = new ClassifiedObservation(new TrafficObservation(cellId, datetime, 10, 10));
        row.setCsLabel(csLabel);
        row.setDataLabel(dataLabel);
        return row;
    }
}
