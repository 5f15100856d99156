package com.telemetrylens.core.stats;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics over a baseline window.
 *
 * <p>
 * Every variance in the engine is the <strong>population</strong> variance
 * ({@code / n}); the helpers here are the single implementation of it.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineEstimator {

    private BaselineEstimator() {
        // utility class, not instantiable
    }

    /**
     * Estimate statistics over finite values. Non-finite entries are ignored.
     *
     * @param values baseline values; must not be {@code null}
     * @return the statistics, or an insufficient-data outcome when no finite
     *         value remains
     */
    public static Outcome<BaselineStats> estimate(double[] values) {
        Objects.requireNonNull(values, "Baseline values must not be null");
        double[] sorted = Arrays.stream(values).filter(Double::isFinite).sorted().toArray();
        if (sorted.length == 0) {
            return Outcome.insufficientData("Baseline window has no data points");
        }

        double mean = mean(sorted);
        double median = median(sorted);
        double[] deviations = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            deviations[i] = Math.abs(sorted[i] - median);
        }
        Arrays.sort(deviations);

        return Outcome.ok(BaselineStats.builder()
                .sortedValues(sorted)
                .mean(mean)
                .stddev(stddev(sorted, mean))
                .median(median)
                .mad(median(deviations))
                .build());
    }

    /**
     * Estimate statistics over the present points of a series.
     */
    public static Outcome<BaselineStats> estimate(List<TimeSeriesPoint> points) {
        return estimate(SeriesWindow.finiteValues(points));
    }

    // ---------------------------------------------------------------
    // Shared statistics helpers
    // ---------------------------------------------------------------

    /**
     * @return arithmetic mean, or {@code NaN} for an empty array
     */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation around a precomputed mean.
     */
    public static double stddev(double[] values, double mean) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    public static double stddev(double[] values) {
        return stddev(values, mean(values));
    }

    /**
     * @param sorted values sorted ascending; must not be empty
     * @return the middle value, or the average of the two middle values
     */
    public static double median(double[] sorted) {
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
