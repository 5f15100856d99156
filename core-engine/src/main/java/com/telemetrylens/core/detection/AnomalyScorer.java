package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.Anomaly;
import com.telemetrylens.core.model.AnomalyContext;
import com.telemetrylens.core.model.AnomalyDirection;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares analysis-window points to a threshold and ranks what crosses it.
 *
 * <h3>Scoring</h3>
 * <p>
 * A point is a spike when {@code value > threshold} and a drop when the
 * threshold is two-sided and {@code value < lower}. A spike scores
 * {@code (value - mean) / stddev} and a drop {@code (mean - value) / stddev};
 * both are {@code 0} when the baseline has no spread. Anomalies are ranked by score descending, then by earlier
 * timestamp, and truncated to {@code maxResults}.
 * </p>
 *
 * <h3>Enrichment</h3>
 * <p>
 * The {@link com.telemetrylens.core.source.EnrichmentSource} is called only
 * for anomalies that survive truncation. A failing callback is logged and
 * the anomaly is kept without context.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyScorer {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScorer.class);

    static final Comparator<Anomaly> RANKING = Comparator
            .comparingDouble(Anomaly::getDeviationScore).reversed()
            .thenComparing(Anomaly::getTimestamp);

    private final ScoringOptions options;

    public AnomalyScorer(ScoringOptions options) {
        this.options = Objects.requireNonNull(options, "Scoring options must not be null");
    }

    /**
     * @param analysis  analysis-window points; missing buckets are skipped
     * @param baseline  statistics of the baseline window
     * @param threshold boundary derived from {@code baseline}
     * @return ranked and truncated anomalies
     */
    public ScoringResult score(List<TimeSeriesPoint> analysis, BaselineStats baseline, ThresholdSpec threshold) {
        Objects.requireNonNull(analysis, "Analysis points must not be null");
        Objects.requireNonNull(baseline, "Baseline stats must not be null");
        Objects.requireNonNull(threshold, "Threshold must not be null");

        List<Anomaly> flagged = new ArrayList<>();
        for (TimeSeriesPoint point : analysis) {
            if (point.isMissing()) {
                LOG.trace("Skipping missing bucket at {}", point.getTimestamp());
                continue;
            }
            double value = point.getValue();
            if (value > threshold.getValue()) {
                flagged.add(toAnomaly(point, baseline, threshold, threshold.getValue(), AnomalyDirection.SPIKE));
            } else if (threshold.isTwoSided() && value < threshold.getLowerValue()) {
                flagged.add(toAnomaly(point, baseline, threshold, threshold.getLowerValue(), AnomalyDirection.DROP));
            }
        }

        flagged.sort(RANKING);
        List<Anomaly> kept = flagged.size() > options.getMaxResults()
                ? flagged.subList(0, options.getMaxResults())
                : flagged;

        List<Anomaly> enriched = kept.stream().map(this::enrich).toList();
        return new ScoringResult(enriched, flagged.size());
    }

    /**
     * @return {@code (value - mean) / stddev}, or {@code 0} when
     *         {@code stddev == 0}
     */
    public static double deviationScore(double value, BaselineStats baseline) {
        if (baseline.getStddev() == 0) {
            return 0;
        }
        return (value - baseline.getMean()) / baseline.getStddev();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Anomaly toAnomaly(TimeSeriesPoint point, BaselineStats baseline, ThresholdSpec threshold,
            double boundary, AnomalyDirection direction) {
        double score = direction == AnomalyDirection.SPIKE
                ? deviationScore(point.getValue(), baseline)
                : -deviationScore(point.getValue(), baseline);
        LOG.debug("Flagged {} at {}: value={} boundary={} score={}",
                direction, point.getTimestamp(), point.getValue(), boundary, score);
        return Anomaly.builder()
                .series(options.getSeriesName())
                .timestamp(point.getTimestamp())
                .observedValue(point.getValue())
                .expectedValue(baseline.getMean())
                .deviationScore(score)
                .thresholdKind(threshold.getKind())
                .threshold(boundary)
                .direction(direction)
                .build();
    }

    private Anomaly enrich(Anomaly anomaly) {
        try {
            Optional<AnomalyContext> context = options.getEnrichment()
                    .sampleContext(anomaly.getTimestamp(), options.getEnrichmentWindow());
            return context.map(anomaly::withContext).orElse(anomaly);
        } catch (RuntimeException e) {
            LOG.warn("Enrichment failed for anomaly at {}, continuing without context: {}",
                    anomaly.getTimestamp(), e.getMessage());
            return anomaly;
        }
    }
}
