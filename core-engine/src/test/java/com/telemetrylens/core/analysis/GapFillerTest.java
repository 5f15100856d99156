package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.GapFillPolicy;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GapFiller}.
 */
class GapFillerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should drop missing buckets")
    void shouldDrop() {
        List<TimeSeriesPoint> filled = GapFiller.fill(series(1.0, null, 3.0), GapFillPolicy.DROP);

        assertThat(values(filled)).containsExactly(1.0, 3.0);
    }

    @Test
    @DisplayName("Should fill missing buckets with zero")
    void shouldFillZero() {
        List<TimeSeriesPoint> filled = GapFiller.fill(series(1.0, null, 3.0), GapFillPolicy.ZERO);

        assertThat(values(filled)).containsExactly(1.0, 0.0, 3.0);
        assertThat(filled.get(1).getTimestamp()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    @DisplayName("Should carry the previous value forward, starting from zero")
    void shouldFillPrevious() {
        List<TimeSeriesPoint> filled = GapFiller.fill(series(null, 2.0, null, null, 5.0), GapFillPolicy.PREVIOUS);

        assertThat(values(filled)).containsExactly(0.0, 2.0, 2.0, 2.0, 5.0);
    }

    @Test
    @DisplayName("Should interpolate interior gaps linearly and copy the nearest value at the edges")
    void shouldInterpolate() {
        List<TimeSeriesPoint> filled = GapFiller.fill(series(null, 1.0, null, null, 4.0, null),
                GapFillPolicy.INTERPOLATE);

        assertThat(values(filled)).containsExactly(1.0, 1.0, 2.0, 3.0, 4.0, 4.0);
    }

    @Test
    @DisplayName("Should parse policy names and default to drop")
    void shouldParsePolicy() {
        assertThat(GapFillPolicy.fromString("Interpolate")).isEqualTo(GapFillPolicy.INTERPOLATE);
        assertThat(GapFillPolicy.fromString(" ")).isEqualTo(GapFillPolicy.DROP);
        assertThat(GapFillPolicy.fromString(null)).isEqualTo(GapFillPolicy.DROP);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<TimeSeriesPoint> series(Double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Instant ts = T0.plusSeconds(60L * i);
            points.add(values[i] == null ? TimeSeriesPoint.missing(ts) : TimeSeriesPoint.of(ts, values[i]));
        }
        return points;
    }

    private static List<Double> values(List<TimeSeriesPoint> points) {
        return points.stream().map(TimeSeriesPoint::getValue).toList();
    }
}
