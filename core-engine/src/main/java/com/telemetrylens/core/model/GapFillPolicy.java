package com.telemetrylens.core.model;

import com.telemetrylens.core.error.InvalidParameterException;

import java.util.Locale;

/**
 * What to do with missing buckets before analysis.
 */
public enum GapFillPolicy {
    /** Remove missing buckets. */
    DROP,
    /** Replace with {@code 0}. */
    ZERO,
    /** Carry the last present value forward. */
    PREVIOUS,
    /** Linear between the nearest present neighbours. */
    INTERPOLATE;

    /**
     * @return {@code false} for policies that turn a missing counter sample
     *         into a fake reset ({@code ZERO}) or a fake stall ({@code PREVIOUS})
     */
    public boolean preservesCounterRate() {
        return this == DROP || this == INTERPOLATE;
    }

    public static GapFillPolicy fromString(String name) {
        if (name == null || name.isBlank()) {
            return DROP;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("Unknown gap fill policy: '" + name
                    + "'. Supported: drop, zero, previous, interpolate");
        }
    }
}
