package com.telemetrylens.core.model;

/**
 * Optional smoothing applied before trend and seasonality analysis.
 */
public enum SmoothingMethod {
    NONE,
    /** Centred simple moving average. */
    SMA,
    /** Exponential moving average with {@code alpha = 2 / (window + 1)}. */
    EMA
}
