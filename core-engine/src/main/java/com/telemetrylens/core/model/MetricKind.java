package com.telemetrylens.core.model;

import com.telemetrylens.core.error.InvalidParameterException;

import java.util.Locale;

/**
 * Shape of a metric, which decides the preprocessing applied before scoring.
 *
 * @since 1.0.0
 */
public enum MetricKind {

    /** Free-moving value; scored as is. */
    GAUGE,

    /** Cumulative value that may reset; scored on its per-second rate. */
    COUNTER,

    /** Distribution; scored on one extracted percentile per bucket. */
    HISTOGRAM;

    /**
     * @throws InvalidParameterException if the name matches no kind
     */
    public static MetricKind fromString(String name) {
        if (name == null || name.isBlank()) {
            return GAUGE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("Unknown metric kind: '" + name
                    + "'. Supported: gauge, counter, histogram");
        }
    }
}
