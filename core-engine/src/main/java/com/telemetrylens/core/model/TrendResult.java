package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Least-squares line fitted over {@code (index, value)} pairs.
 *
 * <p>
 * The slope is expressed per bucket, not per unit of wall-clock time.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendResult {

    private final double slope;
    private final double intercept;
    private final double rSquared;
    private final TrendDirection direction;
    private final double strengthPct;
    private final TrendSignificance significance;
    private final int sampleSize;

    public TrendResult(double slope, double intercept, double rSquared, TrendDirection direction,
            double strengthPct, TrendSignificance significance, int sampleSize) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.strengthPct = strengthPct;
        this.significance = Objects.requireNonNull(significance, "significance must not be null");
        this.sampleSize = sampleSize;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    /** {@code |slope| / |mean| * 100}, or {@code 0} for a zero mean. */
    public double getStrengthPct() {
        return strengthPct;
    }

    public TrendSignificance getSignificance() {
        return significance;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @return the fitted value at the given bucket index
     */
    public double predict(int index) {
        return intercept + slope * index;
    }

    @Override
    public String toString() {
        return "TrendResult{" + direction.getLabel()
                + ", slope=" + slope
                + ", r2=" + rSquared
                + ", significance=" + significance.getLabel() + '}';
    }
}
