package com.telemetrylens.core.model;

/**
 * Which sections a series analysis report contains. Summary statistics are
 * always present.
 */
public enum AnalysisType {
    BASIC,
    TREND,
    SEASONALITY,
    OUTLIERS,
    FULL;

    public boolean includesTrend() {
        return this == TREND || this == FULL;
    }

    public boolean includesSeasonality() {
        return this == SEASONALITY || this == FULL;
    }

    public boolean includesOutliers() {
        return this == OUTLIERS || this == FULL;
    }

    public boolean includesChangePoints() {
        return this == TREND || this == FULL;
    }
}
