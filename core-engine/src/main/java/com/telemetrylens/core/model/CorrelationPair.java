package com.telemetrylens.core.model;

import java.util.Objects;

/**
 * Pearson correlation between two aligned series. Sign and strength are
 * derived from the coefficient.
 *
 * @since 1.0.0
 */
public final class CorrelationPair {

    private final String seriesA;
    private final String seriesB;
    private final double coefficient;
    private final int sampleSize;

    public CorrelationPair(String seriesA, String seriesB, double coefficient, int sampleSize) {
        this.seriesA = Objects.requireNonNull(seriesA, "seriesA must not be null");
        this.seriesB = Objects.requireNonNull(seriesB, "seriesB must not be null");
        if (coefficient < -1.0 || coefficient > 1.0) {
            // rounding can push a perfect correlation a hair past the bound
            coefficient = Math.max(-1.0, Math.min(1.0, coefficient));
        }
        this.coefficient = coefficient;
        this.sampleSize = sampleSize;
    }

    public String getSeriesA() {
        return seriesA;
    }

    public String getSeriesB() {
        return seriesB;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public CorrelationSign getSign() {
        return CorrelationSign.of(coefficient);
    }

    public CorrelationStrength getStrength() {
        return CorrelationStrength.classify(coefficient);
    }

    /** Number of aligned timestamps the coefficient was computed over. */
    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationPair that))
            return false;
        return seriesA.equals(that.seriesA) && seriesB.equals(that.seriesB)
                && Double.compare(coefficient, that.coefficient) == 0
                && sampleSize == that.sampleSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesA, seriesB, coefficient, sampleSize);
    }

    @Override
    public String toString() {
        return "CorrelationPair{" + seriesA + " ~ " + seriesB
                + ", r=" + coefficient + ", " + getStrength().getLabel() + '}';
    }
}
