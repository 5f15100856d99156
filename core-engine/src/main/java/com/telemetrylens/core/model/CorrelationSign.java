package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CorrelationSign {
    POSITIVE,
    NEGATIVE;

    public static CorrelationSign of(double coefficient) {
        return coefficient < 0 ? NEGATIVE : POSITIVE;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
