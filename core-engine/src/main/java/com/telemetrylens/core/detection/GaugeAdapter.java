package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Passes gauge values through unchanged; only missing buckets are removed.
 */
public class GaugeAdapter implements MetricKindAdapter {

    @Override
    public Outcome<AdaptedSeries> adapt(List<TimeSeriesPoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        List<TimeSeriesPoint> present = SeriesWindow.present(points).stream()
                .sorted(Comparator.comparing(TimeSeriesPoint::getTimestamp))
                .toList();
        if (present.isEmpty()) {
            return Outcome.insufficientData("Series has no data points");
        }
        return Outcome.ok(new AdaptedSeries(getKind(), present, List.of()));
    }

    @Override
    public MetricKind getKind() {
        return MetricKind.GAUGE;
    }
}
