package com.telemetrylens.core.source;

import com.telemetrylens.core.model.AnomalyContext;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Optional callback that decorates anomalies with a sample of what happened
 * around them. It never influences scoring.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnrichmentSource {

    /** Enrichment that never finds anything. */
    EnrichmentSource NONE = (timestamp, window) -> Optional.empty();

    /**
     * @param timestamp anomalous bucket
     * @param window    bucket width to sample around the timestamp
     * @return context for the bucket, if any
     */
    Optional<AnomalyContext> sampleContext(Instant timestamp, Duration window);
}
