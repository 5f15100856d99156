package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.source.EnrichmentSource;

import java.time.Duration;
import java.util.Objects;

/**
 * Knobs of the {@link AnomalyScorer}.
 *
 * @since 1.0.0
 */
public final class ScoringOptions {

    public static final int DEFAULT_MAX_RESULTS = 20;

    private final int maxResults;
    private final String seriesName;
    private final EnrichmentSource enrichment;
    private final Duration enrichmentWindow;

    private ScoringOptions(Builder b) {
        if (b.maxResults <= 0) {
            throw new InvalidParameterException("maxResults must be > 0, got: " + b.maxResults);
        }
        this.maxResults = b.maxResults;
        this.seriesName = b.seriesName;
        this.enrichment = b.enrichment != null ? b.enrichment : EnrichmentSource.NONE;
        this.enrichmentWindow = Objects.requireNonNull(b.enrichmentWindow, "Enrichment window must not be null");
    }

    public static ScoringOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxResults = DEFAULT_MAX_RESULTS;
        private String seriesName;
        private EnrichmentSource enrichment;
        private Duration enrichmentWindow = Duration.ofMinutes(5);

        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder seriesName(String seriesName) {
            this.seriesName = seriesName;
            return this;
        }

        public Builder enrichment(EnrichmentSource enrichment) {
            this.enrichment = enrichment;
            return this;
        }

        public Builder enrichmentWindow(Duration enrichmentWindow) {
            this.enrichmentWindow = enrichmentWindow;
            return this;
        }

        public ScoringOptions build() {
            return new ScoringOptions(this);
        }
    }

    public int getMaxResults() {
        return maxResults;
    }

    public String getSeriesName() {
        return seriesName;
    }

    public EnrichmentSource getEnrichment() {
        return enrichment;
    }

    public Duration getEnrichmentWindow() {
        return enrichmentWindow;
    }
}
