package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A point of the analysis window that crossed its threshold.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp} and {@code thresholdKind} are
 * required; omitting either throws {@link NullPointerException} at build
 * time. Instances are immutable; {@link #withContext(AnomalyContext)}
 * returns a decorated copy.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly {

    private final String series;
    private final Instant timestamp;
    private final double observedValue;
    private final double expectedValue;
    private final double deviationScore;
    private final ThresholdKind thresholdKind;
    private final double threshold;
    private final AnomalyDirection direction;
    private final AnomalyContext context;

    private Anomaly(Builder builder) {
        this.series = builder.series;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.observedValue = builder.observedValue;
        this.expectedValue = builder.expectedValue;
        this.deviationScore = builder.deviationScore;
        this.thresholdKind = Objects.requireNonNull(builder.thresholdKind, "thresholdKind must not be null");
        this.threshold = builder.threshold;
        this.direction = builder.direction != null ? builder.direction : AnomalyDirection.SPIKE;
        this.context = builder.context;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a copy of this anomaly carrying {@code newContext}
     */
    public Anomaly withContext(AnomalyContext newContext) {
        return toBuilder().context(newContext).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .series(series)
                .timestamp(timestamp)
                .observedValue(observedValue)
                .expectedValue(expectedValue)
                .deviationScore(deviationScore)
                .thresholdKind(thresholdKind)
                .threshold(threshold)
                .direction(direction)
                .context(context);
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String series;
        private Instant timestamp;
        private double observedValue;
        private double expectedValue;
        private double deviationScore;
        private ThresholdKind thresholdKind;
        private double threshold;
        private AnomalyDirection direction;
        private AnomalyContext context;

        public Builder series(String series) {
            this.series = series;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder deviationScore(double deviationScore) {
            this.deviationScore = deviationScore;
            return this;
        }

        public Builder thresholdKind(ThresholdKind thresholdKind) {
            this.thresholdKind = thresholdKind;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder direction(AnomalyDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder context(AnomalyContext context) {
            this.context = context;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSeries() {
        return series;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    /**
     * @return distance from the baseline mean in standard deviations,
     *         {@code 0} when the baseline has no spread
     */
    public double getDeviationScore() {
        return deviationScore;
    }

    public ThresholdKind getThresholdKind() {
        return thresholdKind;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return how far past the threshold the value lies, as a percentage of
     *         the threshold; {@code 0} when the threshold is zero
     */
    public double getPercentAboveThreshold() {
        if (threshold == 0 || !Double.isFinite(threshold)) {
            return 0;
        }
        return (observedValue - threshold) / Math.abs(threshold) * 100.0;
    }

    public AnomalyDirection getDirection() {
        return direction;
    }

    /**
     * @return enrichment payload, or {@code null} when none was supplied
     */
    public AnomalyContext getContext() {
        return context;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Objects.equals(series, that.series)
                && timestamp.equals(that.timestamp)
                && Double.compare(observedValue, that.observedValue) == 0
                && thresholdKind == that.thresholdKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(series, timestamp, observedValue, thresholdKind);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "series='" + series + '\'' +
                ", timestamp=" + timestamp +
                ", observed=" + observedValue +
                ", expected=" + expectedValue +
                ", score=" + deviationScore +
                ", direction=" + direction +
                '}';
    }
}
