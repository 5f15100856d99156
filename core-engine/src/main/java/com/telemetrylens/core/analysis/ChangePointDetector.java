package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.ChangePoint;
import com.telemetrylens.core.model.ChangePointType;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.stats.BaselineEstimator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Finds shifts in level or spread by comparing adjacent windows.
 *
 * <p>
 * With {@code w = max(10, floor(n/10))}, every index {@code i} in
 * {@code [w, n-w)} compares the {@code w} points before it with the
 * {@code w} points from it on:
 * </p>
 * <ul>
 * <li>mean shift when {@code |meanAfter - meanBefore| > 2 * stddevBefore}</li>
 * <li>variance change when {@code stddevAfter / stddevBefore} is above 2 or
 * below 0.5; skipped when {@code stddevBefore == 0}</li>
 * </ul>
 * <p>
 * A shift is detected at several consecutive indices; each such run is
 * reported once, at its strongest index.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePointDetector {

    static final int MIN_WINDOW = 10;

    private ChangePointDetector() {
        // utility class, not instantiable
    }

    /**
     * @param points series in timestamp order; missing buckets are ignored
     * @return change points in index order; empty for series shorter than
     *         two windows
     */
    public static List<ChangePoint> detect(List<TimeSeriesPoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        List<TimeSeriesPoint> present = SeriesWindow.present(points);
        double[] values = SeriesWindow.finiteValues(present);
        int n = values.length;
        int w = Math.max(MIN_WINDOW, n / 10);

        List<ChangePoint> result = new ArrayList<>();
        ChangePoint levelRun = null;
        ChangePoint varianceRun = null;
        for (int i = w; i < n - w; i++) {
            double[] before = Arrays.copyOfRange(values, i - w, i);
            double[] after = Arrays.copyOfRange(values, i, i + w);
            double meanBefore = BaselineEstimator.mean(before);
            double meanAfter = BaselineEstimator.mean(after);
            double sdBefore = BaselineEstimator.stddev(before, meanBefore);
            double sdAfter = BaselineEstimator.stddev(after, meanAfter);

            ChangePoint level = null;
            double shift = Math.abs(meanAfter - meanBefore);
            if (shift > 2 * sdBefore) {
                double magnitude = meanBefore == 0 ? shift : shift / Math.abs(meanBefore);
                ChangePointType type = meanAfter > meanBefore ? ChangePointType.INCREASE : ChangePointType.DECREASE;
                level = new ChangePoint(present.get(i).getTimestamp(), i, type, magnitude, meanBefore, meanAfter);
            }
            levelRun = extendRun(levelRun, level, result);

            ChangePoint variance = null;
            if (sdBefore > 0) {
                double ratio = sdAfter / sdBefore;
                if (ratio > 2 || ratio < 0.5) {
                    variance = new ChangePoint(present.get(i).getTimestamp(), i, ChangePointType.VARIANCE,
                            ratio, sdBefore, sdAfter);
                }
            }
            varianceRun = extendRun(varianceRun, variance, result);
        }
        if (levelRun != null) {
            result.add(levelRun);
        }
        if (varianceRun != null) {
            result.add(varianceRun);
        }
        result.sort((a, b) -> Integer.compare(a.getIndex(), b.getIndex()));
        return result;
    }

    /**
     * Keep the strongest candidate of the current run; close the run when the
     * candidate is absent or changes type.
     */
    private static ChangePoint extendRun(ChangePoint run, ChangePoint candidate, List<ChangePoint> result) {
        if (candidate == null) {
            if (run != null) {
                result.add(run);
            }
            return null;
        }
        if (run == null) {
            return candidate;
        }
        if (run.getType() != candidate.getType()) {
            result.add(run);
            return candidate;
        }
        return strength(candidate) > strength(run) ? candidate : run;
    }

    private static double strength(ChangePoint point) {
        if (point.getType() == ChangePointType.VARIANCE) {
            // ratios below 1 are as strong as their reciprocal
            double ratio = point.getMagnitude();
            return ratio == 0 ? Double.MAX_VALUE : Math.max(ratio, 1 / ratio);
        }
        return Math.abs(point.getAfter() - point.getBefore());
    }
}
