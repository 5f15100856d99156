package com.telemetrylens.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered series split at a cutoff instant into a baseline part (points
 * before the cutoff) and an analysis part (points at or after it).
 *
 * <p>
 * Missing buckets are kept in both parts; use {@link #baselineValues()} for
 * the finite values statistics are computed from.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesWindow {

    private final Instant cutoff;
    private final List<TimeSeriesPoint> baseline;
    private final List<TimeSeriesPoint> analysis;

    private SeriesWindow(Instant cutoff, List<TimeSeriesPoint> baseline, List<TimeSeriesPoint> analysis) {
        this.cutoff = cutoff;
        this.baseline = Collections.unmodifiableList(baseline);
        this.analysis = Collections.unmodifiableList(analysis);
    }

    /**
     * Split {@code points} at {@code cutoff}. The input does not need to be
     * sorted; both parts come back in timestamp order.
     *
     * @param points series points; must not be {@code null}
     * @param cutoff first instant of the analysis part; must not be {@code null}
     * @return the split window
     */
    public static SeriesWindow split(List<TimeSeriesPoint> points, Instant cutoff) {
        Objects.requireNonNull(points, "Series points must not be null");
        Objects.requireNonNull(cutoff, "Cutoff must not be null");

        List<TimeSeriesPoint> sorted = new ArrayList<>(points);
        sorted.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));

        List<TimeSeriesPoint> baseline = new ArrayList<>();
        List<TimeSeriesPoint> analysis = new ArrayList<>();
        for (TimeSeriesPoint point : sorted) {
            if (point.getTimestamp().isBefore(cutoff)) {
                baseline.add(point);
            } else {
                analysis.add(point);
            }
        }
        return new SeriesWindow(cutoff, baseline, analysis);
    }

    public Instant getCutoff() {
        return cutoff;
    }

    public List<TimeSeriesPoint> getBaseline() {
        return baseline;
    }

    public List<TimeSeriesPoint> getAnalysis() {
        return analysis;
    }

    public double[] baselineValues() {
        return finiteValues(baseline);
    }

    public List<TimeSeriesPoint> presentAnalysisPoints() {
        return present(analysis);
    }

    /**
     * @return {@code true} when either part has no usable (non-missing) point
     */
    public boolean isDegenerate() {
        return baselineValues().length == 0 || presentAnalysisPoints().isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers shared by the engine
    // ---------------------------------------------------------------

    public static double[] finiteValues(List<TimeSeriesPoint> points) {
        return points.stream()
                .filter(p -> !p.isMissing())
                .mapToDouble(TimeSeriesPoint::getValue)
                .toArray();
    }

    public static List<TimeSeriesPoint> present(List<TimeSeriesPoint> points) {
        return points.stream().filter(p -> !p.isMissing()).toList();
    }

    @Override
    public String toString() {
        return "SeriesWindow{cutoff=" + cutoff
                + ", baseline=" + baseline.size()
                + ", analysis=" + analysis.size() + '}';
    }
}
