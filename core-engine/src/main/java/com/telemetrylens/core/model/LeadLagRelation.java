package com.telemetrylens.core.model;

import java.util.Objects;

/**
 * Best non-zero lag of a cross-correlation. A positive {@code lag} means
 * {@code seriesA} leads {@code seriesB} by that many buckets.
 *
 * @since 1.0.0
 */
public final class LeadLagRelation {

    private final String seriesA;
    private final String seriesB;
    private final int lag;
    private final double coefficient;

    public LeadLagRelation(String seriesA, String seriesB, int lag, double coefficient) {
        this.seriesA = Objects.requireNonNull(seriesA, "seriesA must not be null");
        this.seriesB = Objects.requireNonNull(seriesB, "seriesB must not be null");
        this.lag = lag;
        this.coefficient = coefficient;
    }

    public String getSeriesA() {
        return seriesA;
    }

    public String getSeriesB() {
        return seriesB;
    }

    public int getLag() {
        return lag;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public String getLeader() {
        return lag > 0 ? seriesA : seriesB;
    }

    public String getFollower() {
        return lag > 0 ? seriesB : seriesA;
    }

    @Override
    public String toString() {
        return "LeadLagRelation{" + getLeader() + " leads " + getFollower()
                + " by " + Math.abs(lag) + ", r=" + coefficient + '}';
    }
}
