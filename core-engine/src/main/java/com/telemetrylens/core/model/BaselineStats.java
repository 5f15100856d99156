package com.telemetrylens.core.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive statistics of a baseline window.
 *
 * <p>
 * {@code stddev == 0} is a legal state (constant series). The sorted values
 * are retained so that arbitrary percentiles can be looked up with the same
 * {@code floor(n * p)} indexing as the fixed ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStats {

    private final int count;
    private final double mean;
    private final double stddev;
    private final double mad;
    private final double median;
    private final double min;
    private final double max;
    private final double q1;
    private final double q3;
    private final double[] sortedValues;

    private BaselineStats(Builder b) {
        this.sortedValues = Objects.requireNonNull(b.sortedValues, "sortedValues must not be null");
        if (sortedValues.length == 0) {
            throw new IllegalStateException("BaselineStats requires at least one value");
        }
        this.count = sortedValues.length;
        this.mean = b.mean;
        this.stddev = b.stddev;
        this.mad = b.mad;
        this.median = b.median;
        this.min = sortedValues[0];
        this.max = sortedValues[sortedValues.length - 1];
        this.q1 = percentile(25);
        this.q3 = percentile(75);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Look up a percentile by sorting ascending and indexing at
     * {@code floor(n * p / 100)}, clamped to the last element.
     *
     * @param rank percentile rank in {@code (0, 100]}
     * @return the value at that rank
     */
    public double percentile(double rank) {
        int index = (int) Math.floor(count * (rank / 100.0));
        return sortedValues[Math.max(0, Math.min(count - 1, index))];
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    /** Median absolute deviation from the median. */
    public double getMad() {
        return mad;
    }

    public double getMedian() {
        return median;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    /**
     * @return {@code stddev / |mean|}, or {@code 0} when the mean is zero
     */
    public double getCoefficientOfVariation() {
        return mean == 0 ? 0 : stddev / Math.abs(mean);
    }

    /**
     * @return p50, p75, p90, p95 and p99 keyed by their labels
     */
    public Map<String, Double> getPercentiles() {
        Map<String, Double> percentiles = new LinkedHashMap<>();
        percentiles.put("p50", percentile(50));
        percentiles.put("p75", percentile(75));
        percentiles.put("p90", percentile(90));
        percentiles.put("p95", percentile(95));
        percentiles.put("p99", percentile(99));
        return percentiles;
    }

    /**
     * @return {@code true} when every baseline value is identical
     */
    public boolean isConstant() {
        return stddev == 0;
    }

    /**
     * Fluent builder used by the estimator.
     */
    public static class Builder {
        private double[] sortedValues;
        private double mean;
        private double stddev;
        private double mad;
        private double median;

        /**
         * @param sortedValues values sorted ascending; copied
         */
        public Builder sortedValues(double[] sortedValues) {
            this.sortedValues = sortedValues != null ? Arrays.copyOf(sortedValues, sortedValues.length) : null;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stddev(double stddev) {
            this.stddev = stddev;
            return this;
        }

        public Builder mad(double mad) {
            this.mad = mad;
            return this;
        }

        public Builder median(double median) {
            this.median = median;
            return this;
        }

        public BaselineStats build() {
            return new BaselineStats(this);
        }
    }

    @Override
    public String toString() {
        return "BaselineStats{" +
                "count=" + count +
                ", mean=" + mean +
                ", stddev=" + stddev +
                ", mad=" + mad +
                ", median=" + median +
                ", min=" + min +
                ", max=" + max +
                '}';
    }
}
