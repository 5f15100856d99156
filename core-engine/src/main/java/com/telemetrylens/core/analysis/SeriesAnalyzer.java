package com.telemetrylens.core.analysis;

import com.telemetrylens.core.detection.AnomalyScorer;
import com.telemetrylens.core.detection.ScoringOptions;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.Anomaly;
import com.telemetrylens.core.model.AnalysisType;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.ChangePoint;
import com.telemetrylens.core.model.SeasonalPattern;
import com.telemetrylens.core.model.SeriesAnalysisReport;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.model.TrendResult;
import com.telemetrylens.core.stats.BaselineEstimator;
import com.telemetrylens.core.stats.ThresholdPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Characterises one series: summary statistics plus, depending on the
 * {@link AnalysisType}, trend, change points, seasonal patterns and
 * outliers.
 *
 * <p>
 * Missing buckets are handled by the configured gap-fill policy first.
 * Smoothing, when requested, applies to trend and seasonality only; change
 * points and outliers always see the unsmoothed values. Outliers are points
 * more than 3 standard deviations from the mean of the whole series, in
 * either direction.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesAnalyzer.class);

    private SeriesAnalyzer() {
        // utility class, not instantiable
    }

    /**
     * @param name    series label used in the report
     * @param points  the series; must not be {@code null}
     * @param options what to compute; must not be {@code null}
     * @return the report, or insufficient data for a series without values
     */
    public static Outcome<SeriesAnalysisReport> analyze(String name, List<TimeSeriesPoint> points,
            AnalysisOptions options) {
        Objects.requireNonNull(points, "Series points must not be null");
        Objects.requireNonNull(options, "Analysis options must not be null");

        List<TimeSeriesPoint> filled = GapFiller.fill(points.stream()
                .sorted(Comparator.comparing(TimeSeriesPoint::getTimestamp))
                .toList(), options.getGapFill());
        double[] values = SeriesWindow.finiteValues(filled);

        return BaselineEstimator.estimate(values).map(summary -> {
            AnalysisType type = options.getType();
            double[] smoothed = Smoother.smooth(values, options.getSmoothing(), options.getSmoothingWindow());

            TrendResult trend = type.includesTrend()
                    ? TrendAnalyzer.analyze(smoothed).orElse(null)
                    : null;
            List<ChangePoint> changePoints = type.includesChangePoints()
                    ? ChangePointDetector.detect(filled)
                    : List.of();
            List<SeasonalPattern> seasonal = type.includesSeasonality()
                    ? SeasonalityAnalyzer.detect(smoothed)
                    : List.of();
            List<Anomaly> outliers = type.includesOutliers()
                    ? outliers(name, filled, summary, options.getMaxOutliers())
                    : List.of();

            LOG.info("Analysed series '{}' ({}): {} point(s), trend={}, {} change point(s), "
                    + "{} seasonal pattern(s), {} outlier(s)",
                    name, type, values.length, trend != null ? trend.getDirection().getLabel() : "n/a",
                    changePoints.size(), seasonal.size(), outliers.size());
            return new SeriesAnalysisReport(name, type, values.length, summary, trend, seasonal,
                    changePoints, outliers);
        });
    }

    private static List<Anomaly> outliers(String name, List<TimeSeriesPoint> points, BaselineStats stats,
            int maxOutliers) {
        ThresholdSpec threshold = ThresholdPolicy.deriveTwoSided(stats, ThresholdKind.ZSCORE,
                AnalysisOptions.OUTLIER_ZSCORE);
        AnomalyScorer scorer = new AnomalyScorer(ScoringOptions.builder()
                .maxResults(maxOutliers)
                .seriesName(name)
                .build());
        return scorer.score(points, stats, threshold).getAnomalies();
    }
}
