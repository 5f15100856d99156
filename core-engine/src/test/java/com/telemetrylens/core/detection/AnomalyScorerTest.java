package com.telemetrylens.core.detection;

import com.telemetrylens.core.model.Anomaly;
import com.telemetrylens.core.model.AnomalyContext;
import com.telemetrylens.core.model.AnomalyDirection;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.source.EnrichmentSource;
import com.telemetrylens.core.stats.BaselineEstimator;
import com.telemetrylens.core.stats.ThresholdPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyScorer}.
 */
class AnomalyScorerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static final BaselineStats BASELINE = BaselineEstimator.estimate(new double[] {9, 11}).getValue();
    private static final ThresholdSpec ZSCORE_3 = ThresholdPolicy.derive(BASELINE, ThresholdKind.ZSCORE, 3.0);

    @Test
    @DisplayName("Should flag 14 against mean 10, stddev 1, k 3 with score 4.00")
    void shouldFlagWithDeviationScore() {
        ScoringResult result = scorer(20, null).score(points(12, 14, 13), BASELINE, ZSCORE_3);

        assertThat(result.getAnomalies()).singleElement().satisfies(a -> {
            assertThat(a.getObservedValue()).isEqualTo(14.0);
            assertThat(a.getExpectedValue()).isEqualTo(10.0);
            assertThat(a.getDeviationScore()).isEqualTo(4.0, within(1e-9));
            assertThat(a.getThreshold()).isEqualTo(13.0, within(1e-9));
            assertThat(a.getThresholdKind()).isEqualTo(ThresholdKind.ZSCORE);
            assertThat(a.getDirection()).isEqualTo(AnomalyDirection.SPIKE);
            assertThat(a.getSeries()).isEqualTo("latency");
        });
    }

    @Test
    @DisplayName("Should rank by score descending, ties by earlier timestamp")
    void shouldRankAnomalies() {
        ScoringResult result = scorer(20, null).score(points(14, 16, 15, 14), BASELINE, ZSCORE_3);

        assertThat(result.getAnomalies()).extracting(Anomaly::getObservedValue)
                .containsExactly(16.0, 15.0, 14.0, 14.0);
        assertThat(result.getAnomalies().get(2).getTimestamp()).isEqualTo(T0);
        assertThat(result.getAnomalies().get(3).getTimestamp()).isEqualTo(T0.plusSeconds(180));
    }

    @Test
    @DisplayName("Should truncate to maxResults and keep the untruncated count")
    void shouldTruncate() {
        ScoringResult result = scorer(2, null).score(points(14, 16, 15), BASELINE, ZSCORE_3);

        assertThat(result.getAnomalies()).extracting(Anomaly::getObservedValue).containsExactly(16.0, 15.0);
        assertThat(result.getTotalFlagged()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should never flag anything over a constant baseline")
    void shouldNotFlagOverConstantBaseline() {
        BaselineStats constant = BaselineEstimator.estimate(new double[] {5, 5, 5}).getValue();
        ThresholdSpec threshold = ThresholdPolicy.derive(constant, ThresholdKind.ZSCORE, 0.5);

        ScoringResult result = scorer(20, null).score(points(6, 1e9, -1e9), constant, threshold);

        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should score zero when the baseline has no spread but a fixed threshold is crossed")
    void shouldScoreZeroWithoutSpread() {
        BaselineStats constant = BaselineEstimator.estimate(new double[] {5, 5, 5}).getValue();
        ThresholdSpec threshold = ThresholdPolicy.derive(constant, ThresholdKind.FIXED, 8.0);

        ScoringResult result = scorer(20, null).score(points(9), constant, threshold);

        assertThat(result.getAnomalies()).singleElement()
                .satisfies(a -> assertThat(a.getDeviationScore()).isZero());
    }

    @Test
    @DisplayName("Should flag drops below the lower boundary of a two-sided threshold")
    void shouldFlagDrops() {
        ThresholdSpec twoSided = ThresholdPolicy.deriveTwoSided(BASELINE, ThresholdKind.ZSCORE, 3.0);

        ScoringResult result = scorer(20, null).score(points(10, 5), BASELINE, twoSided);

        assertThat(result.getAnomalies()).singleElement().satisfies(a -> {
            assertThat(a.getDirection()).isEqualTo(AnomalyDirection.DROP);
            assertThat(a.getDeviationScore()).isEqualTo(5.0, within(1e-9));
            assertThat(a.getThreshold()).isEqualTo(7.0, within(1e-9));
        });
    }

    @Test
    @DisplayName("Should enrich only the anomalies that survive truncation")
    void shouldEnrichKeptAnomaliesOnly() {
        AtomicInteger calls = new AtomicInteger();
        EnrichmentSource enrichment = (timestamp, window) -> {
            calls.incrementAndGet();
            return Optional.of(new AnomalyContext("checkout", "error", List.of("boom")));
        };

        ScoringResult result = scorer(1, enrichment).score(points(14, 16, 15), BASELINE, ZSCORE_3);

        assertThat(calls).hasValue(1);
        assertThat(result.getAnomalies().get(0).getContext().getDominantService()).isEqualTo("checkout");
    }

    @Test
    @DisplayName("Should keep the anomaly without context when enrichment fails")
    void shouldSurviveEnrichmentFailure() {
        EnrichmentSource failing = (timestamp, window) -> {
            throw new IllegalStateException("log store down");
        };

        ScoringResult result = scorer(20, failing).score(points(14), BASELINE, ZSCORE_3);

        assertThat(result.getAnomalies()).singleElement()
                .satisfies(a -> assertThat(a.getContext()).isNull());
    }

    @Test
    @DisplayName("Should skip missing buckets in the analysis window")
    void shouldSkipMissingBuckets() {
        List<TimeSeriesPoint> analysis = List.of(TimeSeriesPoint.missing(T0), TimeSeriesPoint.of(T0.plusSeconds(60), 20));

        assertThat(scorer(20, null).score(analysis, BASELINE, ZSCORE_3).getTotalFlagged()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyScorer scorer(int maxResults, EnrichmentSource enrichment) {
        return new AnomalyScorer(ScoringOptions.builder()
                .maxResults(maxResults)
                .seriesName("latency")
                .enrichment(enrichment)
                .build());
    }

    private static List<TimeSeriesPoint> points(double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(TimeSeriesPoint.of(T0.plusSeconds(i * 60L), values[i]));
        }
        return points;
    }
}
