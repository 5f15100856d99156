package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Deseasonalizer}.
 */
class DeseasonalizerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration PERIOD = Duration.ofMinutes(3);

    @Test
    @DisplayName("Should flatten a repeating cycle to the baseline mean")
    void shouldFlattenCycle() {
        List<TimeSeriesPoint> adjusted = Deseasonalizer.remove(minutes(1, 5, 9, 1, 5, 9, 1, 5, 9),
                PERIOD, T0.plus(Duration.ofMinutes(6)));

        assertThat(adjusted).extracting(TimeSeriesPoint::getValue).containsOnly(5.0);
    }

    @Test
    @DisplayName("Should learn the profile from the baseline only")
    void shouldLearnProfileFromBaseline() {
        List<TimeSeriesPoint> adjusted = Deseasonalizer.remove(minutes(1, 5, 9, 1, 5, 9, 1, 50, 9),
                PERIOD, T0.plus(Duration.ofMinutes(6)));

        assertThat(adjusted.get(7).getValue()).isEqualTo(50.0);
        assertThat(adjusted.get(8).getValue()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should keep missing buckets and slots the baseline never saw")
    void shouldKeepUnknownSlotsAndMissingBuckets() {
        List<TimeSeriesPoint> points = minutes(2, 4, 2, 4);
        points.add(TimeSeriesPoint.missing(T0.plus(Duration.ofMinutes(4))));
        points.add(TimeSeriesPoint.of(T0.plus(Duration.ofSeconds(4 * 60 + 30)), 100));

        List<TimeSeriesPoint> adjusted = Deseasonalizer.remove(points, Duration.ofMinutes(2),
                T0.plus(Duration.ofMinutes(4)));

        assertThat(adjusted.get(4).isMissing()).isTrue();
        assertThat(adjusted.get(5).getValue()).isEqualTo(100.0);
        assertThat(adjusted.subList(0, 4)).extracting(TimeSeriesPoint::getValue).containsOnly(3.0);
    }

    @Test
    @DisplayName("Should return the series unchanged without baseline points")
    void shouldReturnUnchangedWithoutBaseline() {
        List<TimeSeriesPoint> points = minutes(1, 5, 9);

        assertThat(Deseasonalizer.remove(points, PERIOD, T0)).isSameAs(points);
    }

    @Test
    @DisplayName("Should reject a non-positive period")
    void shouldRejectZeroPeriod() {
        assertThatThrownBy(() -> Deseasonalizer.remove(minutes(1, 2), Duration.ZERO, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<TimeSeriesPoint> minutes(double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(TimeSeriesPoint.of(T0.plus(Duration.ofMinutes(i)), values[i]));
        }
        return points;
    }
}
