package com.telemetrylens.core.source;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.TimeRange;

import java.time.Duration;
import java.util.Objects;

/**
 * A validated request for one bucketed series.
 *
 * @since 1.0.0
 */
public final class SeriesQuery {

    private final SeriesTarget target;
    private final Aggregation aggregation;
    private final Duration interval;
    private final TimeRange range;
    private final double percentile;

    private SeriesQuery(Builder b) {
        this.target = Objects.requireNonNull(b.target, "Series target must not be null");
        this.interval = Objects.requireNonNull(b.interval, "Interval must not be null");
        this.range = Objects.requireNonNull(b.range, "Time range must not be null");
        this.aggregation = b.aggregation != null ? b.aggregation : defaultAggregation(target);
        this.percentile = b.percentile;
        if (interval.isZero() || interval.isNegative()) {
            throw new InvalidParameterException("Interval must be positive, got: " + interval);
        }
        if (interval.compareTo(range.length()) > 0) {
            throw new InvalidParameterException("Interval " + interval
                    + " is longer than the time range " + range);
        }
        if (aggregation == Aggregation.PERCENTILE && (percentile <= 0 || percentile > 100)) {
            throw new InvalidParameterException("Percentile must be in (0, 100], got: " + percentile);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the aggregation that suits a metric of the given kind
     */
    public static Aggregation aggregationFor(MetricKind kind) {
        return switch (kind) {
            case GAUGE -> Aggregation.AVG;
            case COUNTER -> Aggregation.MAX;
            case HISTOGRAM -> Aggregation.PERCENTILE;
        };
    }

    private static Aggregation defaultAggregation(SeriesTarget target) {
        return switch (target.getKind()) {
            case LOG_COUNT, LOG_PATTERN -> Aggregation.COUNT;
            case LOG_CARDINALITY -> Aggregation.DISTINCT_COUNT;
            case FIELD, QUERY -> Aggregation.AVG;
        };
    }

    public static class Builder {
        private SeriesTarget target;
        private Aggregation aggregation;
        private Duration interval;
        private TimeRange range;
        private double percentile = 99.0;

        public Builder target(SeriesTarget target) {
            this.target = target;
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder range(TimeRange range) {
            this.range = range;
            return this;
        }

        public Builder percentile(double percentile) {
            this.percentile = percentile;
            return this;
        }

        public SeriesQuery build() {
            return new SeriesQuery(this);
        }
    }

    public SeriesTarget getTarget() {
        return target;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public Duration getInterval() {
        return interval;
    }

    public TimeRange getRange() {
        return range;
    }

    public double getPercentile() {
        return percentile;
    }

    @Override
    public String toString() {
        return "SeriesQuery{" + target + ", " + aggregation + ", every " + interval + " over " + range + '}';
    }
}
