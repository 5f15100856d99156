package com.telemetrylens.core.model;

import com.telemetrylens.core.error.InvalidParameterException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes one anomaly-analysis rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code metric}: baseline/threshold scoring of a numeric field, with
 * per-kind preprocessing for gauges, counters and histograms</li>
 * <li>{@code frequency}: two-sided scoring of per-interval log volume,
 * optionally narrowed by {@code target} as a query</li>
 * <li>{@code pattern}: spike scoring of per-interval occurrences of
 * {@code pattern}</li>
 * <li>{@code cardinality}: spike scoring of the number of distinct values
 * of the log field {@code target} per interval</li>
 * </ul>
 *
 * <p>
 * Any rule may set {@code seasonalPeriod} to score values with the average
 * profile of that period removed.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. It reports
 * every problem at once, before any series is fetched.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisRule {

    public static final String TYPE_METRIC = "metric";
    public static final String TYPE_FREQUENCY = "frequency";
    public static final String TYPE_PATTERN = "pattern";
    public static final String TYPE_CARDINALITY = "cardinality";

    /** Unique rule name used in reports and metrics. */
    private String name;

    /** Rule type: "metric", "frequency", "pattern" or "cardinality". */
    private String type;

    /** Field name (metric, cardinality) or log query (frequency). */
    private String target;

    /** Text token counted by pattern rules. */
    private String pattern;

    private String metricKind = "gauge";

    private String threshold = "zscore";

    /**
     * Multiplier, rank or absolute value depending on {@link #threshold};
     * {@code null} selects the kind's default.
     */
    private Double thresholdValue;

    /** Also flag values below the mirrored lower boundary (metric rules). */
    private boolean twoSided;

    private int maxResults = 20;

    private String interval = "5m";

    /** Baseline length preceding the analysis range. */
    private String lookback = "24h";

    /** Percentile extracted from histogram buckets. */
    private double percentile = 99.0;

    private String gapFill = "drop";

    /** Pattern and cardinality rules: also flag {@code count > mean * spikeMultiplier}. */
    private Double spikeMultiplier;

    /** Length of the seasonal cycle to remove before scoring; unset disables it. */
    private String seasonalPeriod;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws InvalidParameterException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        } else {
            switch (type) {
                case TYPE_METRIC -> {
                    if (target == null || target.isBlank()) {
                        errors.add("Metric rule '" + name + "' requires 'target'");
                    }
                }
                case TYPE_FREQUENCY -> {
                    // target is optional: all logs are counted when absent
                }
                case TYPE_PATTERN -> {
                    if (pattern == null || pattern.isBlank()) {
                        errors.add("Pattern rule '" + name + "' requires 'pattern'");
                    }
                    if (spikeMultiplier != null && spikeMultiplier <= 1.0) {
                        errors.add("Pattern rule '" + name + "' requires 'spikeMultiplier' > 1");
                    }
                }
                case TYPE_CARDINALITY -> {
                    if (target == null || target.isBlank()) {
                        errors.add("Cardinality rule '" + name + "' requires 'target'");
                    }
                    if (spikeMultiplier != null && spikeMultiplier <= 1.0) {
                        errors.add("Cardinality rule '" + name + "' requires 'spikeMultiplier' > 1");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: metric, frequency, pattern, cardinality");
            }
        }

        MetricKind kind = null;
        try {
            kind = MetricKind.fromString(metricKind);
        } catch (InvalidParameterException e) {
            errors.add(e.getMessage());
        }
        try {
            ThresholdKind thresholdKind = ThresholdKind.fromString(threshold);
            if (kind != null) {
                errors.addAll(thresholdKind.parameterErrors(thresholdValue, kind));
            }
        } catch (InvalidParameterException e) {
            errors.add(e.getMessage());
        }
        try {
            GapFillPolicy policy = GapFillPolicy.fromString(gapFill);
            if (kind == MetricKind.COUNTER && TYPE_METRIC.equals(type) && !policy.preservesCounterRate()) {
                errors.add("Counter rule '" + name + "' does not support gapFill '" + gapFill
                        + "'. Supported: drop, interpolate");
            }
        } catch (InvalidParameterException e) {
            errors.add(e.getMessage());
        }

        if (maxResults <= 0) {
            errors.add("Rule '" + name + "' requires 'maxResults' > 0");
        }
        Duration intervalLength = Intervals.tryParse(interval);
        if (intervalLength == null) {
            errors.add("Rule '" + name + "' has invalid 'interval': " + interval);
        }
        Duration lookbackLength = Intervals.tryParse(lookback);
        if (lookbackLength == null) {
            errors.add("Rule '" + name + "' has invalid 'lookback': " + lookback);
        }
        if (seasonalPeriod != null) {
            Duration period = Intervals.tryParse(seasonalPeriod);
            if (period == null) {
                errors.add("Rule '" + name + "' has invalid 'seasonalPeriod': " + seasonalPeriod);
            } else {
                if (intervalLength != null && period.compareTo(intervalLength) <= 0) {
                    errors.add("Rule '" + name + "' requires 'seasonalPeriod' longer than 'interval'");
                }
                if (lookbackLength != null && lookbackLength.compareTo(period.multipliedBy(2)) < 0) {
                    errors.add("Rule '" + name + "' requires 'lookback' of at least two seasonal periods");
                }
            }
        }
        if (percentile <= 0 || percentile > 100) {
            errors.add("Rule '" + name + "' requires 'percentile' in (0, 100]");
        }

        if (!errors.isEmpty()) {
            throw new InvalidParameterException(
                    "Invalid AnalysisRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public MetricKind metricKind() {
        return MetricKind.fromString(metricKind);
    }

    public ThresholdKind thresholdKind() {
        return ThresholdKind.fromString(threshold);
    }

    public GapFillPolicy gapFillPolicy() {
        return GapFillPolicy.fromString(gapFill);
    }

    public Duration intervalDuration() {
        return Intervals.parse(interval);
    }

    public Duration lookbackDuration() {
        return Intervals.parse(lookback);
    }

    /**
     * @return the seasonal period, or {@code null} when seasonal adjustment
     *         is off
     */
    public Duration seasonalPeriodDuration() {
        return seasonalPeriod != null ? Intervals.parse(seasonalPeriod) : null;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public String getMetricKind() {
        return metricKind;
    }

    public void setMetricKind(String metricKind) {
        this.metricKind = metricKind;
    }

    public String getThreshold() {
        return threshold;
    }

    public void setThreshold(String threshold) {
        this.threshold = threshold;
    }

    public Double getThresholdValue() {
        return thresholdValue;
    }

    public void setThresholdValue(Double thresholdValue) {
        this.thresholdValue = thresholdValue;
    }

    public boolean isTwoSided() {
        return twoSided;
    }

    public void setTwoSided(boolean twoSided) {
        this.twoSided = twoSided;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public String getLookback() {
        return lookback;
    }

    public void setLookback(String lookback) {
        this.lookback = lookback;
    }

    public double getPercentile() {
        return percentile;
    }

    public void setPercentile(double percentile) {
        this.percentile = percentile;
    }

    public String getGapFill() {
        return gapFill;
    }

    public void setGapFill(String gapFill) {
        this.gapFill = gapFill;
    }

    public Double getSpikeMultiplier() {
        return spikeMultiplier;
    }

    public void setSpikeMultiplier(Double spikeMultiplier) {
        this.spikeMultiplier = spikeMultiplier;
    }

    public String getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(String seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod != null && !seasonalPeriod.isBlank() ? seasonalPeriod : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "AnalysisRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", target='" + target + '\'' +
                ", pattern='" + pattern + '\'' +
                ", metricKind='" + metricKind + '\'' +
                ", threshold='" + threshold + '\'' +
                ", thresholdValue=" + thresholdValue +
                ", interval='" + interval + '\'' +
                ", lookback='" + lookback + '\'' +
                '}';
    }
}
