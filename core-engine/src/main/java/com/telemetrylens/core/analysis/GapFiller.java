package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.GapFillPolicy;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replaces or removes missing buckets according to a {@link GapFillPolicy}.
 *
 * @since 1.0.0
 */
public final class GapFiller {

    private GapFiller() {
        // utility class, not instantiable
    }

    /**
     * @param points series in timestamp order; must not be {@code null}
     * @param policy what to do with missing buckets; must not be {@code null}
     * @return a new list without missing buckets
     */
    public static List<TimeSeriesPoint> fill(List<TimeSeriesPoint> points, GapFillPolicy policy) {
        Objects.requireNonNull(points, "Series points must not be null");
        Objects.requireNonNull(policy, "Gap fill policy must not be null");

        return switch (policy) {
            case DROP -> points.stream().filter(p -> !p.isMissing()).toList();
            case ZERO -> points.stream().map(p -> p.isMissing() ? p.withValue(0.0) : p).toList();
            case PREVIOUS -> fillPrevious(points);
            case INTERPOLATE -> interpolate(points);
        };
    }

    private static List<TimeSeriesPoint> fillPrevious(List<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> filled = new ArrayList<>(points.size());
        double last = 0;
        for (TimeSeriesPoint p : points) {
            if (p.isMissing()) {
                filled.add(p.withValue(last));
            } else {
                last = p.getValue();
                filled.add(p);
            }
        }
        return filled;
    }

    private static List<TimeSeriesPoint> interpolate(List<TimeSeriesPoint> points) {
        int n = points.size();
        List<TimeSeriesPoint> filled = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            TimeSeriesPoint p = points.get(i);
            if (!p.isMissing()) {
                filled.add(p);
                continue;
            }
            int prev = i - 1;
            while (prev >= 0 && points.get(prev).isMissing()) {
                prev--;
            }
            int next = i + 1;
            while (next < n && points.get(next).isMissing()) {
                next++;
            }
            if (prev < 0 && next >= n) {
                // nothing to interpolate from
                continue;
            }
            double value;
            if (prev < 0) {
                value = points.get(next).getValue();
            } else if (next >= n) {
                value = points.get(prev).getValue();
            } else {
                double from = points.get(prev).getValue();
                double to = points.get(next).getValue();
                value = from + (to - from) * (i - prev) / (double) (next - prev);
            }
            filled.add(p.withValue(value));
        }
        return filled;
    }
}
