package com.telemetrylens.core.source;

import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter to the data store that materialises bucketed series.
 *
 * <p>
 * Implementations own query construction, pagination, response parsing and
 * any retries. A failed fetch completes the future exceptionally; callers
 * surface it as a {@link com.telemetrylens.core.error.SourceUnavailableException}.
 * Missing buckets are returned as points with a {@code null} value.
 * </p>
 *
 * @since 1.0.0
 */
public interface SeriesSource {

    /**
     * @param query what to fetch; already validated
     * @return the points of the series ordered by timestamp
     */
    CompletableFuture<List<TimeSeriesPoint>> fetchBucketed(SeriesQuery query);
}
