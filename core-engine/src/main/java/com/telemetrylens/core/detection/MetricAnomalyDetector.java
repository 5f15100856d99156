package com.telemetrylens.core.detection;

import com.telemetrylens.core.analysis.GapFiller;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.GapFillPolicy;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.stats.ThresholdPolicy;

import java.util.List;

/**
 * Anomaly detector for a numeric metric field.
 *
 * <p>
 * The series is gap-filled, transformed by the {@link MetricKindAdapter} of
 * its kind (so counters are scored on their rate), split at the cutoff and
 * scored against a threshold of the configured kind. With
 * {@code twoSided} the mirrored lower boundary also flags drops.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricAnomalyDetector extends BaselineDetector {

    private final MetricKind metricKind;
    private final ThresholdKind thresholdKind;
    private final Double thresholdValue;
    private final boolean twoSided;
    private final GapFillPolicy gapFill;

    /**
     * @param rule       a validated metric rule
     * @param enrichment optional anomaly decoration; may be {@code null}
     */
    public MetricAnomalyDetector(AnalysisRule rule, EnrichmentSource enrichment) {
        super(rule, rule.getTarget(), enrichment);
        this.metricKind = rule.metricKind();
        this.thresholdKind = rule.thresholdKind();
        this.thresholdValue = rule.getThresholdValue();
        this.twoSided = rule.isTwoSided();
        this.gapFill = rule.gapFillPolicy();
        ThresholdPolicy.validate(thresholdKind, thresholdValue, metricKind);
    }

    @Override
    protected Outcome<AdaptedSeries> prepare(List<TimeSeriesPoint> points) {
        return MetricKindAdapters.forKind(metricKind).adapt(GapFiller.fill(points, gapFill));
    }

    @Override
    protected ThresholdSpec threshold(BaselineStats baseline) {
        return twoSided
                ? ThresholdPolicy.deriveTwoSided(baseline, thresholdKind, thresholdValue)
                : ThresholdPolicy.derive(baseline, thresholdKind, thresholdValue);
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    public ThresholdKind getThresholdKind() {
        return thresholdKind;
    }
}
