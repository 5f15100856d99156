package com.telemetrylens.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One bucket of a histogram metric, carrying the percentiles the data store
 * computed for it (keys are percentile ranks such as {@code 99.0}).
 *
 * @since 1.0.0
 */
public final class HistogramBucket {

    private final Instant timestamp;
    private final Map<Double, Double> percentiles;

    public HistogramBucket(Instant timestamp, Map<Double, Double> percentiles) {
        this.timestamp = Objects.requireNonNull(timestamp, "Bucket timestamp must not be null");
        this.percentiles = percentiles != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(percentiles))
                : Map.of();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<Double, Double> getPercentiles() {
        return percentiles;
    }

    public Optional<Double> percentile(double rank) {
        return Optional.ofNullable(percentiles.get(rank));
    }

    @Override
    public String toString() {
        return "HistogramBucket{" + timestamp + ", " + percentiles + '}';
    }
}
