package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.List;

/**
 * Per-kind preprocessing applied to a series before it is scored.
 *
 * <p>
 * Implementations are stateless and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricKindAdapter {

    /**
     * @param points the raw series in any order; missing buckets allowed
     * @return the transformed series, or insufficient data when the kind
     *         cannot be derived from what was supplied
     */
    Outcome<AdaptedSeries> adapt(List<TimeSeriesPoint> points);

    MetricKind getKind();
}
