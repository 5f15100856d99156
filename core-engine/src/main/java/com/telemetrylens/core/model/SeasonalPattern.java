package com.telemetrylens.core.model;

/**
 * A peak of the autocorrelation function; {@code lag} is the candidate
 * period in buckets.
 *
 * @since 1.0.0
 */
public final class SeasonalPattern {

    private final int lag;
    private final double autocorrelation;

    public SeasonalPattern(int lag, double autocorrelation) {
        this.lag = lag;
        this.autocorrelation = autocorrelation;
    }

    public int getLag() {
        return lag;
    }

    public double getAutocorrelation() {
        return autocorrelation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalPattern that))
            return false;
        return lag == that.lag && Double.compare(autocorrelation, that.autocorrelation) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * lag + Double.hashCode(autocorrelation);
    }

    @Override
    public String toString() {
        return "SeasonalPattern{lag=" + lag + ", acf=" + autocorrelation + '}';
    }
}
