package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.ChangePoint;
import com.telemetrylens.core.model.ChangePointType;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChangePointDetector}.
 */
class ChangePointDetectorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should report a level shift once, at the index where it happens")
    void shouldReportLevelShiftOnce() {
        List<TimeSeriesPoint> points = new ArrayList<>(alternating(0, 20, 10));
        points.addAll(alternating(20, 20, 20));

        List<ChangePoint> shifts = ChangePointDetector.detect(points).stream()
                .filter(cp -> cp.getType() != ChangePointType.VARIANCE)
                .toList();

        assertThat(shifts).singleElement().satisfies(cp -> {
            assertThat(cp.getType()).isEqualTo(ChangePointType.INCREASE);
            assertThat(cp.getIndex()).isEqualTo(20);
            assertThat(cp.getTimestamp()).isEqualTo(T0.plusSeconds(20 * 60));
            assertThat(cp.getBefore()).isEqualTo(10.5, within(1e-9));
            assertThat(cp.getAfter()).isEqualTo(20.5, within(1e-9));
            assertThat(cp.getMagnitude()).isEqualTo(10 / 10.5, within(1e-9));
        });
    }

    @Test
    @DisplayName("Should report a level drop as a decrease")
    void shouldReportDecrease() {
        List<TimeSeriesPoint> points = new ArrayList<>(alternating(0, 20, 50));
        points.addAll(alternating(20, 20, 10));

        assertThat(ChangePointDetector.detect(points))
                .filteredOn(cp -> cp.getType() == ChangePointType.DECREASE)
                .extracting(ChangePoint::getIndex)
                .containsExactly(20);
    }

    @Test
    @DisplayName("Should find nothing in a stationary series")
    void shouldIgnoreStationarySeries() {
        assertThat(ChangePointDetector.detect(alternating(0, 40, 10))).isEmpty();
    }

    @Test
    @DisplayName("Should find nothing when the series is shorter than two windows")
    void shouldIgnoreShortSeries() {
        List<TimeSeriesPoint> points = new ArrayList<>(alternating(0, 9, 10));
        points.addAll(alternating(9, 9, 100));

        assertThat(ChangePointDetector.detect(points)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Values alternate between {@code base} and {@code base + 1}, one per minute. */
    private static List<TimeSeriesPoint> alternating(int firstIndex, int count, double base) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = firstIndex; i < firstIndex + count; i++) {
            points.add(TimeSeriesPoint.of(T0.plusSeconds(60L * i), i % 2 == 0 ? base : base + 1));
        }
        return points;
    }
}
