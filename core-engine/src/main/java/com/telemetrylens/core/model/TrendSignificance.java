package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Heuristic confidence bucket for a fitted trend, derived from R².
 */
public enum TrendSignificance {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * @param rSquared coefficient of determination
     * @return {@code HIGH} above 0.7, {@code MEDIUM} above 0.3, else {@code LOW}
     */
    public static TrendSignificance fromRSquared(double rSquared) {
        if (rSquared > 0.7) {
            return HIGH;
        }
        if (rSquared > 0.3) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
