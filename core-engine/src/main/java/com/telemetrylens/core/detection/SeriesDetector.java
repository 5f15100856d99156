package com.telemetrylens.core.detection;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.DetectionReport;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.time.Instant;
import java.util.List;

/**
 * Contract for all series detectors.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: every call is a pure
 * function of the series it is given, so one instance may serve concurrent
 * requests.
 * </p>
 */
public interface SeriesDetector {

    /**
     * Split {@code points} at {@code cutoff}, learn the baseline from the
     * points before it and score the points at or after it.
     *
     * @param points materialised series; missing buckets allowed
     * @param cutoff first instant of the analysis window
     * @return the report, or an insufficient-data outcome when either window
     *         has no usable points
     */
    Outcome<DetectionReport> detect(List<TimeSeriesPoint> points, Instant cutoff);

    /**
     * Return the unique name of the rule this detector enforces.
     *
     * @return rule name
     */
    String getRuleName();
}
