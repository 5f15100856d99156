package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.AnalysisRule;
import com.telemetrylens.core.model.DetectionReport;
import com.telemetrylens.core.model.TimeRange;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.source.SeriesFetch;
import com.telemetrylens.core.source.SeriesQuery;
import com.telemetrylens.core.source.SeriesSource;
import com.telemetrylens.core.source.SeriesTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Fetch, split and detect for one rule.
 *
 * <p>
 * The rule is validated synchronously, before anything is fetched. The
 * series is requested over the analysis range extended back by the rule's
 * lookback; the start of the analysis range is the cutoff between baseline
 * and analysis windows. A failed fetch completes the returned future with a
 * {@link com.telemetrylens.core.error.SourceUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionPipeline.class);

    private final SeriesSource source;
    private final EnrichmentSource enrichment;

    public DetectionPipeline(SeriesSource source, EnrichmentSource enrichment) {
        this.source = Objects.requireNonNull(source, "Series source must not be null");
        this.enrichment = enrichment;
    }

    /**
     * @param rule          the rule to run; must not be {@code null}
     * @param analysisRange range to check for anomalies
     * @return the detection outcome
     * @throws com.telemetrylens.core.error.InvalidParameterException if the
     *         rule is invalid; thrown before any fetch
     */
    public CompletableFuture<Outcome<DetectionReport>> run(AnalysisRule rule, TimeRange analysisRange) {
        Objects.requireNonNull(analysisRange, "Analysis range must not be null");
        SeriesDetector detector = DetectorFactory.create(rule, enrichment);
        SeriesQuery query = queryFor(rule, analysisRange);

        LOG.info("Rule [{}]: fetching {}", rule.getName(), query);
        return SeriesFetch.fetch(source, query).thenApply(points -> detector.detect(points, analysisRange.getStart()));
    }

    /**
     * Build the fetch request for a validated rule.
     */
    public static SeriesQuery queryFor(AnalysisRule rule, TimeRange analysisRange) {
        Duration lookback = rule.lookbackDuration();
        SeriesQuery.Builder query = SeriesQuery.builder()
                .target(targetOf(rule))
                .interval(rule.intervalDuration())
                .range(analysisRange.extendBack(lookback))
                .percentile(rule.getPercentile());
        if (AnalysisRule.TYPE_METRIC.equals(rule.getType())) {
            query.aggregation(SeriesQuery.aggregationFor(rule.metricKind()));
        }
        return query.build();
    }

    static SeriesTarget targetOf(AnalysisRule rule) {
        return switch (rule.getType()) {
            case AnalysisRule.TYPE_FREQUENCY -> SeriesTarget.logCount(rule.getTarget());
            case AnalysisRule.TYPE_PATTERN -> SeriesTarget.logPattern(rule.getPattern());
            case AnalysisRule.TYPE_CARDINALITY -> SeriesTarget.logCardinality(rule.getTarget());
            default -> SeriesTarget.field(rule.getTarget());
        };
    }
}
