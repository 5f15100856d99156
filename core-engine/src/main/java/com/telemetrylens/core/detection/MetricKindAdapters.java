package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.MetricKind;

import java.util.Objects;

/**
 * Lookup of the shared adapter for each {@link MetricKind}.
 */
public final class MetricKindAdapters {

    private static final MetricKindAdapter GAUGE = new GaugeAdapter();
    private static final MetricKindAdapter COUNTER = new CounterRateAdapter();
    private static final MetricKindAdapter HISTOGRAM = new HistogramPercentileAdapter();

    private MetricKindAdapters() {
        // utility class, not instantiable
    }

    public static MetricKindAdapter forKind(MetricKind kind) {
        Objects.requireNonNull(kind, "Metric kind must not be null");
        return switch (kind) {
            case GAUGE -> GAUGE;
            case COUNTER -> COUNTER;
            case HISTOGRAM -> HISTOGRAM;
        };
    }
}
