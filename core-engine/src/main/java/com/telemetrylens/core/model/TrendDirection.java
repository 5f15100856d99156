package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sign of a fitted slope.
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
