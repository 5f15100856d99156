package com.telemetrylens.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of running one detector over one series.
 *
 * <p>
 * {@code anomalies} holds at most {@code maxResults} entries ranked by
 * deviation score; {@link #getTotalFlagged()} counts every flagged point
 * before truncation.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionReport {

    private final String ruleName;
    private final String series;
    private final MetricKind metricKind;
    private final ThresholdSpec threshold;
    private final BaselineStats baseline;
    private final List<Anomaly> anomalies;
    private final int analyzedPoints;
    private final int totalFlagged;
    private final List<CounterReset> counterResets;

    private DetectionReport(Builder b) {
        this.ruleName = Objects.requireNonNull(b.ruleName, "ruleName must not be null");
        this.series = b.series;
        this.metricKind = b.metricKind != null ? b.metricKind : MetricKind.GAUGE;
        this.threshold = Objects.requireNonNull(b.threshold, "threshold must not be null");
        this.baseline = Objects.requireNonNull(b.baseline, "baseline must not be null");
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(b.anomalies));
        this.analyzedPoints = b.analyzedPoints;
        this.totalFlagged = b.totalFlagged;
        this.counterResets = Collections.unmodifiableList(new ArrayList<>(b.counterResets));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleName;
        private String series;
        private MetricKind metricKind;
        private ThresholdSpec threshold;
        private BaselineStats baseline;
        private List<Anomaly> anomalies = List.of();
        private int analyzedPoints;
        private int totalFlagged;
        private List<CounterReset> counterResets = List.of();

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder series(String series) {
            this.series = series;
            return this;
        }

        public Builder metricKind(MetricKind metricKind) {
            this.metricKind = metricKind;
            return this;
        }

        public Builder threshold(ThresholdSpec threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder baseline(BaselineStats baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder anomalies(List<Anomaly> anomalies) {
            this.anomalies = anomalies != null ? anomalies : List.of();
            return this;
        }

        public Builder analyzedPoints(int analyzedPoints) {
            this.analyzedPoints = analyzedPoints;
            return this;
        }

        public Builder totalFlagged(int totalFlagged) {
            this.totalFlagged = totalFlagged;
            return this;
        }

        public Builder counterResets(List<CounterReset> counterResets) {
            this.counterResets = counterResets != null ? counterResets : List.of();
            return this;
        }

        public DetectionReport build() {
            return new DetectionReport(this);
        }
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getSeries() {
        return series;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    public ThresholdSpec getThreshold() {
        return threshold;
    }

    public BaselineStats getBaseline() {
        return baseline;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public int getAnalyzedPoints() {
        return analyzedPoints;
    }

    public int getTotalFlagged() {
        return totalFlagged;
    }

    public List<CounterReset> getCounterResets() {
        return counterResets;
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    @Override
    public String toString() {
        return "DetectionReport{rule='" + ruleName + '\''
                + ", threshold=" + threshold
                + ", analyzed=" + analyzedPoints
                + ", flagged=" + totalFlagged
                + ", returned=" + anomalies.size() + '}';
    }
}
