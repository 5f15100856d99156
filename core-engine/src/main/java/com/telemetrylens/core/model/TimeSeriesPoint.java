package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One bucket of a bucketed series.
 *
 * <p>
 * A {@code null} value marks a missing bucket. Missing buckets must be
 * filtered (or filled) before any statistics are computed.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TimeSeriesPoint {

    private final Instant timestamp;
    private final Double value;

    @JsonCreator
    public TimeSeriesPoint(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") Double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "Point timestamp must not be null");
        this.value = value;
    }

    public static TimeSeriesPoint of(Instant timestamp, double value) {
        return new TimeSeriesPoint(timestamp, value);
    }

    public static TimeSeriesPoint missing(Instant timestamp) {
        return new TimeSeriesPoint(timestamp, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the bucket value, or {@code null} for a missing bucket
     */
    public Double getValue() {
        return value;
    }

    /**
     * @return {@code true} when the value is absent, NaN or infinite
     */
    @JsonIgnore
    public boolean isMissing() {
        return value == null || !Double.isFinite(value);
    }

    public TimeSeriesPoint withValue(Double newValue) {
        return new TimeSeriesPoint(timestamp, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesPoint that))
            return false;
        return timestamp.equals(that.timestamp) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "(" + timestamp + ", " + value + ")";
    }
}
