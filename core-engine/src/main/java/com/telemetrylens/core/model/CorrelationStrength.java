package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Verbal bucket for the magnitude of a correlation coefficient.
 */
public enum CorrelationStrength {
    VERY_STRONG,
    STRONG,
    MODERATE,
    WEAK,
    VERY_WEAK;

    /**
     * @param coefficient Pearson coefficient; only its magnitude matters
     */
    public static CorrelationStrength classify(double coefficient) {
        double abs = Math.abs(coefficient);
        if (abs >= 0.9) {
            return VERY_STRONG;
        }
        if (abs >= 0.7) {
            return STRONG;
        }
        if (abs >= 0.5) {
            return MODERATE;
        }
        if (abs >= 0.3) {
            return WEAK;
        }
        return VERY_WEAK;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
