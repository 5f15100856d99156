package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.HistogramBucket;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.List;
import java.util.Objects;

/**
 * Histogram series arrive as one extracted percentile per bucket and are
 * then scored exactly like a gauge.
 *
 * <p>
 * Use {@link #extract(List, double)} when the data store returned the full
 * per-bucket percentile maps instead.
 * </p>
 */
public class HistogramPercentileAdapter extends GaugeAdapter {

    /**
     * Pick one percentile from every bucket; buckets lacking it are dropped.
     *
     * @param buckets    per-bucket percentile maps; must not be {@code null}
     * @param percentile rank to extract, e.g. {@code 99.0}
     * @return one point per bucket that carried the percentile
     */
    public static List<TimeSeriesPoint> extract(List<HistogramBucket> buckets, double percentile) {
        Objects.requireNonNull(buckets, "Histogram buckets must not be null");
        return buckets.stream()
                .filter(b -> b.percentile(percentile).isPresent())
                .map(b -> TimeSeriesPoint.of(b.getTimestamp(), b.percentile(percentile).get()))
                .toList();
    }

    @Override
    public MetricKind getKind() {
        return MetricKind.HISTOGRAM;
    }
}
