package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.ErrorKind;
import com.telemetrylens.core.model.CounterReset;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CounterRateAdapter}.
 */
class CounterRateAdapterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final CounterRateAdapter adapter = new CounterRateAdapter();

    @Test
    @DisplayName("Should turn a steady counter into a constant per-second rate")
    void shouldComputeRate() {
        AdaptedSeries rates = adapter.adapt(counter(1, 0, 100, 200, 300)).getValue();

        assertThat(rates.getPoints()).extracting(TimeSeriesPoint::getValue).containsExactly(100.0, 100.0, 100.0);
        assertThat(rates.getPoints().get(0).getTimestamp()).isEqualTo(T0.plusSeconds(1));
        assertThat(rates.getCounterResets()).isEmpty();
    }

    @Test
    @DisplayName("Should divide by elapsed seconds")
    void shouldDivideByElapsedTime() {
        AdaptedSeries rates = adapter.adapt(counter(60, 0, 600)).getValue();

        assertThat(rates.getPoints()).extracting(TimeSeriesPoint::getValue).containsExactly(10.0);
    }

    @Test
    @DisplayName("Should skip a reset instead of emitting a negative rate")
    void shouldSkipReset() {
        AdaptedSeries rates = adapter.adapt(counter(1, 0, 100, 50, 150)).getValue();

        assertThat(rates.getPoints()).extracting(TimeSeriesPoint::getValue).containsExactly(100.0, 100.0);
        assertThat(rates.getPoints()).extracting(TimeSeriesPoint::getTimestamp)
                .containsExactly(T0.plusSeconds(1), T0.plusSeconds(3));
        assertThat(rates.getCounterResets()).containsExactly(new CounterReset(T0.plusSeconds(2), 100, 50));
    }

    @Test
    @DisplayName("Should report insufficient data with fewer than two present points")
    void shouldRequireTwoPoints() {
        List<TimeSeriesPoint> points = List.of(TimeSeriesPoint.of(T0, 5), TimeSeriesPoint.missing(T0.plusSeconds(1)));

        assertThat(adapter.adapt(points).getErrorKind()).isEqualTo(ErrorKind.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("Should bridge missing buckets using the surrounding present points")
    void shouldBridgeMissingBuckets() {
        List<TimeSeriesPoint> points = List.of(
                TimeSeriesPoint.of(T0, 0),
                TimeSeriesPoint.missing(T0.plusSeconds(1)),
                TimeSeriesPoint.of(T0.plusSeconds(2), 50));

        assertThat(adapter.adapt(points).getValue().getPoints())
                .containsExactly(TimeSeriesPoint.of(T0.plusSeconds(2), 25));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<TimeSeriesPoint> counter(long stepSeconds, double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(TimeSeriesPoint.of(T0.plusSeconds(i * stepSeconds), values[i]));
        }
        return points;
    }
}
