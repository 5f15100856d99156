package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.source.SeriesTarget;
import com.telemetrylens.core.stats.ThresholdPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Flags spikes in how often a log pattern occurs.
 *
 * <p>
 * Buckets in which the pattern never occurred are ignored, so the baseline
 * describes how frequent the pattern is when it appears at all. With a
 * {@code spikeMultiplier} a bucket is also a spike when
 * {@code count > mean * spikeMultiplier}; the effective threshold is the
 * lower of the two boundaries.
 * </p>
 */
public class PatternDetector extends BaselineDetector {

    private static final Logger LOG = LoggerFactory.getLogger(PatternDetector.class);

    private final ThresholdKind thresholdKind;
    private final Double thresholdValue;
    private final Double spikeMultiplier;

    public PatternDetector(AnalysisRule rule, EnrichmentSource enrichment) {
        super(rule, SeriesTarget.logPattern(rule.getPattern()).label(), enrichment);
        this.thresholdKind = rule.thresholdKind();
        this.thresholdValue = rule.getThresholdValue();
        this.spikeMultiplier = rule.getSpikeMultiplier();
    }

    @Override
    protected Outcome<AdaptedSeries> prepare(List<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> occurrences = points.stream()
                .filter(p -> !p.isMissing() && p.getValue() > 0)
                .toList();
        LOG.trace("Rule [{}]: {} of {} bucket(s) contain the pattern", ruleName, occurrences.size(), points.size());
        return new GaugeAdapter().adapt(occurrences);
    }

    @Override
    protected ThresholdSpec threshold(BaselineStats baseline) {
        return withSpikeMultiplier(ThresholdPolicy.derive(baseline, thresholdKind, thresholdValue),
                baseline, spikeMultiplier);
    }

    /**
     * @return the lower of {@code statistical} and {@code mean * multiplier};
     *         {@code statistical} when there is no multiplier
     */
    static ThresholdSpec withSpikeMultiplier(ThresholdSpec statistical, BaselineStats baseline, Double multiplier) {
        if (multiplier == null || baseline.getMean() <= 0) {
            return statistical;
        }
        double multiplied = baseline.getMean() * multiplier;
        if (multiplied >= statistical.getValue()) {
            return statistical;
        }
        return new ThresholdSpec(statistical.getKind(), multiplied, String.format(Locale.ROOT,
                "mean x %.2f (%.2f)", multiplier, multiplied));
    }
}
