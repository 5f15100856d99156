package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.CounterReset;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a cumulative counter into its per-second rate.
 *
 * <p>
 * For each consecutive pair of present points the rate
 * {@code (v[i] - v[i-1]) / (t[i] - t[i-1])} is emitted at {@code t[i]}. A
 * pair where the value went down is a counter reset: no rate is emitted for
 * it and a {@link CounterReset} is recorded instead. Pairs sharing a
 * timestamp are skipped.
 * </p>
 */
public class CounterRateAdapter implements MetricKindAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(CounterRateAdapter.class);

    @Override
    public Outcome<AdaptedSeries> adapt(List<TimeSeriesPoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        List<TimeSeriesPoint> present = SeriesWindow.present(points).stream()
                .sorted(Comparator.comparing(TimeSeriesPoint::getTimestamp))
                .toList();
        if (present.size() < 2) {
            return Outcome.insufficientData("Rate computation needs at least 2 points, got " + present.size());
        }

        List<TimeSeriesPoint> rates = new ArrayList<>(present.size() - 1);
        List<CounterReset> resets = new ArrayList<>();
        for (int i = 1; i < present.size(); i++) {
            TimeSeriesPoint prev = present.get(i - 1);
            TimeSeriesPoint curr = present.get(i);
            if (curr.getValue() < prev.getValue()) {
                LOG.warn("Counter reset at {}: {} -> {}, rate skipped",
                        curr.getTimestamp(), prev.getValue(), curr.getValue());
                resets.add(new CounterReset(curr.getTimestamp(), prev.getValue(), curr.getValue()));
                continue;
            }
            double seconds = Duration.between(prev.getTimestamp(), curr.getTimestamp()).toNanos() / 1e9;
            if (seconds <= 0) {
                LOG.trace("Duplicate counter timestamp {}, skipping", curr.getTimestamp());
                continue;
            }
            rates.add(TimeSeriesPoint.of(curr.getTimestamp(), (curr.getValue() - prev.getValue()) / seconds));
        }
        return Outcome.ok(new AdaptedSeries(getKind(), rates, resets));
    }

    @Override
    public MetricKind getKind() {
        return MetricKind.COUNTER;
    }
}
