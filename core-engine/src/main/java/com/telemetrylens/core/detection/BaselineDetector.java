package com.telemetrylens.core.detection;

import com.telemetrylens.core.analysis.Deseasonalizer;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.DetectionReport;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.stats.BaselineEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Shared split, estimate, threshold and score pipeline. Subclasses decide
 * how the raw series is prepared and how the threshold is derived.
 *
 * <p>
 * When the rule has a seasonal period the prepared series is adjusted by
 * {@link Deseasonalizer} before the split, so reported values are the
 * adjusted ones.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class BaselineDetector implements SeriesDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineDetector.class);

    protected final String ruleName;
    protected final String seriesName;
    private final AnomalyScorer scorer;
    private final Duration seasonalPeriod;

    protected BaselineDetector(AnalysisRule rule, String seriesName, EnrichmentSource enrichment) {
        Objects.requireNonNull(rule, "AnalysisRule must not be null");
        this.ruleName = Objects.requireNonNull(rule.getName(), "Rule name must not be null");
        this.seriesName = seriesName;
        this.scorer = new AnomalyScorer(ScoringOptions.builder()
                .maxResults(rule.getMaxResults())
                .seriesName(seriesName)
                .enrichment(enrichment)
                .enrichmentWindow(rule.intervalDuration())
                .build());
        this.seasonalPeriod = rule.seasonalPeriodDuration();
    }

    @Override
    public Outcome<DetectionReport> detect(List<TimeSeriesPoint> points, Instant cutoff) {
        Objects.requireNonNull(points, "Series points must not be null");
        Objects.requireNonNull(cutoff, "Cutoff must not be null");

        Outcome<DetectionReport> report = prepare(points).flatMap(adapted -> score(adapted, cutoff));
        if (!report.isOk()) {
            LOG.warn("Rule [{}]: {}", ruleName, report.getDetail());
        }
        return report;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }

    /**
     * Turn the raw series into the one that is split and scored.
     */
    protected abstract Outcome<AdaptedSeries> prepare(List<TimeSeriesPoint> points);

    /**
     * Derive the boundary from the baseline statistics.
     */
    protected abstract ThresholdSpec threshold(BaselineStats baseline);

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Outcome<DetectionReport> score(AdaptedSeries adapted, Instant cutoff) {
        List<TimeSeriesPoint> points = seasonalPeriod != null
                ? Deseasonalizer.remove(adapted.getPoints(), seasonalPeriod, cutoff)
                : adapted.getPoints();
        SeriesWindow window = SeriesWindow.split(points, cutoff);
        if (window.baselineValues().length == 0) {
            return Outcome.insufficientData("Baseline window before " + cutoff + " has no data points");
        }
        List<TimeSeriesPoint> analysis = window.presentAnalysisPoints();
        if (analysis.isEmpty()) {
            return Outcome.insufficientData("Analysis window from " + cutoff + " has no data points");
        }

        return BaselineEstimator.estimate(window.baselineValues()).map(baseline -> {
            ThresholdSpec threshold = threshold(baseline);
            ScoringResult result = scorer.score(analysis, baseline, threshold);
            LOG.info("Rule [{}]: threshold {}, {} of {} point(s) flagged",
                    ruleName, threshold.getDescription(), result.getTotalFlagged(), analysis.size());
            return DetectionReport.builder()
                    .ruleName(ruleName)
                    .series(seriesName)
                    .metricKind(adapted.getKind())
                    .threshold(threshold)
                    .baseline(baseline)
                    .anomalies(result.getAnomalies())
                    .analyzedPoints(analysis.size())
                    .totalFlagged(result.getTotalFlagged())
                    .counterResets(adapted.getCounterResets())
                    .build();
        });
    }
}
