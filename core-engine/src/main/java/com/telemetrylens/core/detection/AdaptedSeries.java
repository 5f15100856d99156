package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.CounterReset;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.List;
import java.util.Objects;

/**
 * A series after per-kind preprocessing, ready to be split and scored.
 *
 * @since 1.0.0
 */
public final class AdaptedSeries {

    private final MetricKind kind;
    private final List<TimeSeriesPoint> points;
    private final List<CounterReset> counterResets;

    public AdaptedSeries(MetricKind kind, List<TimeSeriesPoint> points, List<CounterReset> counterResets) {
        this.kind = Objects.requireNonNull(kind, "Metric kind must not be null");
        this.points = List.copyOf(points);
        this.counterResets = counterResets != null ? List.copyOf(counterResets) : List.of();
    }

    public MetricKind getKind() {
        return kind;
    }

    /** Present points only, in timestamp order. */
    public List<TimeSeriesPoint> getPoints() {
        return points;
    }

    /** Resets skipped while deriving a counter rate; empty for other kinds. */
    public List<CounterReset> getCounterResets() {
        return counterResets;
    }
}
