package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.InvalidParameterException;

/**
 * Filters applied to pairwise correlations.
 *
 * @since 1.0.0
 */
public final class CorrelationOptions {

    public static final double DEFAULT_MIN_CORRELATION = 0.7;

    private final double minCorrelation;
    private final boolean includeAntiCorrelations;
    private final boolean includeLeadLag;

    private CorrelationOptions(Builder b) {
        if (b.minCorrelation < 0 || b.minCorrelation > 1) {
            throw new InvalidParameterException("minCorrelation must be in [0, 1], got: " + b.minCorrelation);
        }
        this.minCorrelation = b.minCorrelation;
        this.includeAntiCorrelations = b.includeAntiCorrelations;
        this.includeLeadLag = b.includeLeadLag;
    }

    public static CorrelationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minCorrelation = DEFAULT_MIN_CORRELATION;
        private boolean includeAntiCorrelations = true;
        private boolean includeLeadLag;

        /** Minimum {@code |r|} a pair needs to be reported. */
        public Builder minCorrelation(double minCorrelation) {
            this.minCorrelation = minCorrelation;
            return this;
        }

        public Builder includeAntiCorrelations(boolean includeAntiCorrelations) {
            this.includeAntiCorrelations = includeAntiCorrelations;
            return this;
        }

        public Builder includeLeadLag(boolean includeLeadLag) {
            this.includeLeadLag = includeLeadLag;
            return this;
        }

        public CorrelationOptions build() {
            return new CorrelationOptions(this);
        }
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public boolean isIncludeAntiCorrelations() {
        return includeAntiCorrelations;
    }

    public boolean isIncludeLeadLag() {
        return includeLeadLag;
    }
}
