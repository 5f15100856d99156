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
 * Flags log-volume spikes and drops.
 *
 * <p>
 * The per-interval log count is scored two-sided:
 * {@code count > mean + k * stddev} is a spike and
 * {@code count < mean - k * stddev} a drop, with {@code k} defaulting to 3.
 * A constant baseline flags nothing.
 * </p>
 */
public class FrequencyDetector extends BaselineDetector {

    private final ThresholdKind thresholdKind;
    private final Double thresholdValue;
    private final GapFillPolicy gapFill;

    public FrequencyDetector(AnalysisRule rule, EnrichmentSource enrichment) {
        super(rule, SeriesTarget.logCount(rule.getTarget()).label(), enrichment);
        this.thresholdKind = rule.thresholdKind();
        this.thresholdValue = rule.getThresholdValue();
        this.gapFill = rule.gapFillPolicy();
    }

    @Override
    protected Outcome<AdaptedSeries> prepare(List<TimeSeriesPoint> points) {
        return new GaugeAdapter().adapt(GapFiller.fill(points, gapFill));
    }

    @Override
    protected ThresholdSpec threshold(BaselineStats baseline) {
        return ThresholdPolicy.deriveTwoSided(baseline, thresholdKind, thresholdValue);
    }
}
