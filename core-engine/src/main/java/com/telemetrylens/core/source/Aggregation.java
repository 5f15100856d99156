package com.telemetrylens.core.source;

/**
 * Per-bucket aggregation requested from the data store.
 */
public enum Aggregation {
    AVG,
    SUM,
    MAX,
    MIN,
    COUNT,
    /** Number of distinct values of the field in the bucket. */
    DISTINCT_COUNT,
    /** One percentile of the bucket's distribution; see {@link SeriesQuery#getPercentile()}. */
    PERCENTILE
}
