package com.telemetrylens.core.detection;

import com.telemetrylens.core.analysis.GapFiller;
import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.GapFillPolicy;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.source.SeriesTarget;
import com.telemetrylens.core.stats.ThresholdPolicy;

import java.util.List;

/**
 * Flags sudden growth in the number of distinct values of a log field, such
 * as a burst of new error types or client addresses.
 *
 * <p>
 * Scored one-sided like {@link PatternDetector}, with the same optional
 * {@code spikeMultiplier}. Buckets with fewer than
 * {@value #MIN_DISTINCT_VALUES} distinct values are never flagged.
 * </p>
 */
public class CardinalityDetector extends BaselineDetector {

    static final int MIN_DISTINCT_VALUES = 3;

    private final ThresholdKind thresholdKind;
    private final Double thresholdValue;
    private final Double spikeMultiplier;
    private final GapFillPolicy gapFill;

    public CardinalityDetector(AnalysisRule rule, EnrichmentSource enrichment) {
        super(rule, SeriesTarget.logCardinality(rule.getTarget()).label(), enrichment);
        this.thresholdKind = rule.thresholdKind();
        this.thresholdValue = rule.getThresholdValue();
        this.spikeMultiplier = rule.getSpikeMultiplier();
        this.gapFill = rule.gapFillPolicy();
    }

    @Override
    protected Outcome<AdaptedSeries> prepare(List<TimeSeriesPoint> points) {
        return new GaugeAdapter().adapt(GapFiller.fill(points, gapFill));
    }

    @Override
    protected ThresholdSpec threshold(BaselineStats baseline) {
        ThresholdSpec threshold = PatternDetector.withSpikeMultiplier(
                ThresholdPolicy.derive(baseline, thresholdKind, thresholdValue), baseline, spikeMultiplier);
        double floor = MIN_DISTINCT_VALUES - 1;
        if (threshold.getValue() >= floor) {
            return threshold;
        }
        return new ThresholdSpec(thresholdKind, floor,
                threshold.getDescription() + ", raised to at least " + MIN_DISTINCT_VALUES + " distinct values");
    }
}
