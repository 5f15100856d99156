package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Removes a repeating profile from a series before it is scored.
 *
 * <p>
 * Each point belongs to the slot {@code epochMillis mod period}. The profile
 * is learned from present points before the cutoff only, so an anomaly in
 * the analysis window does not pull its own slot average up. A point becomes
 * {@code value - slotMean + baselineMean}; points whose slot never occurs in
 * the baseline, and missing buckets, are left as they are.
 * </p>
 *
 * <p>
 * Slots are exact phase offsets, which assumes the source buckets on
 * boundaries aligned to the epoch.
 * </p>
 *
 * @since 1.0.0
 */
public final class Deseasonalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Deseasonalizer.class);

    private Deseasonalizer() {
        // utility class, not instantiable
    }

    /**
     * @param points series points, in any order
     * @param period cycle length; must be positive
     * @param cutoff first instant of the analysis window
     * @return adjusted points in input order
     */
    public static List<TimeSeriesPoint> remove(List<TimeSeriesPoint> points, Duration period, Instant cutoff) {
        Objects.requireNonNull(points, "Series points must not be null");
        Objects.requireNonNull(period, "Seasonal period must not be null");
        Objects.requireNonNull(cutoff, "Cutoff must not be null");
        long periodMs = period.toMillis();
        if (periodMs <= 0) {
            throw new IllegalArgumentException("Seasonal period must be positive, got: " + period);
        }

        Map<Long, double[]> slots = new HashMap<>();
        double sum = 0;
        int count = 0;
        for (TimeSeriesPoint point : points) {
            if (point.isMissing() || !point.getTimestamp().isBefore(cutoff)) {
                continue;
            }
            double[] acc = slots.computeIfAbsent(slotOf(point.getTimestamp(), periodMs), k -> new double[2]);
            acc[0] += point.getValue();
            acc[1]++;
            sum += point.getValue();
            count++;
        }
        if (count == 0) {
            LOG.debug("No baseline points before {}, seasonal profile not applied", cutoff);
            return points;
        }
        double baselineMean = sum / count;
        LOG.debug("Seasonal profile of {} slot(s) over period {} from {} baseline point(s)",
                slots.size(), period, count);

        List<TimeSeriesPoint> adjusted = new ArrayList<>(points.size());
        for (TimeSeriesPoint point : points) {
            double[] acc = point.isMissing() ? null : slots.get(slotOf(point.getTimestamp(), periodMs));
            if (acc == null) {
                adjusted.add(point);
            } else {
                adjusted.add(point.withValue(point.getValue() - acc[0] / acc[1] + baselineMean));
            }
        }
        return adjusted;
    }

    static long slotOf(Instant timestamp, long periodMs) {
        return Math.floorMod(timestamp.toEpochMilli(), periodMs);
    }
}
