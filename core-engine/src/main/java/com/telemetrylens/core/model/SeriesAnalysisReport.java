package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Characterisation of a single series. Sections not requested by the
 * {@link AnalysisType} are {@code null} (trend) or empty (lists).
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SeriesAnalysisReport {

    private final String series;
    private final AnalysisType type;
    private final int pointCount;
    private final BaselineStats summary;
    private final TrendResult trend;
    private final List<SeasonalPattern> seasonalPatterns;
    private final List<ChangePoint> changePoints;
    private final List<Anomaly> outliers;

    public SeriesAnalysisReport(String series, AnalysisType type, int pointCount, BaselineStats summary,
            TrendResult trend, List<SeasonalPattern> seasonalPatterns, List<ChangePoint> changePoints,
            List<Anomaly> outliers) {
        this.series = series;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.pointCount = pointCount;
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.trend = trend;
        this.seasonalPatterns = seasonalPatterns != null ? List.copyOf(seasonalPatterns) : List.of();
        this.changePoints = changePoints != null ? List.copyOf(changePoints) : List.of();
        this.outliers = outliers != null ? List.copyOf(outliers) : List.of();
    }

    public String getSeries() {
        return series;
    }

    public AnalysisType getType() {
        return type;
    }

    public int getPointCount() {
        return pointCount;
    }

    public BaselineStats getSummary() {
        return summary;
    }

    public TrendResult getTrend() {
        return trend;
    }

    public List<SeasonalPattern> getSeasonalPatterns() {
        return seasonalPatterns;
    }

    public boolean isSeasonal() {
        return !seasonalPatterns.isEmpty();
    }

    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public List<Anomaly> getOutliers() {
        return outliers;
    }

    @Override
    public String toString() {
        return "SeriesAnalysisReport{series='" + series + "', type=" + type
                + ", points=" + pointCount
                + ", trend=" + trend
                + ", seasonal=" + seasonalPatterns.size()
                + ", changePoints=" + changePoints.size()
                + ", outliers=" + outliers.size() + '}';
    }
}
