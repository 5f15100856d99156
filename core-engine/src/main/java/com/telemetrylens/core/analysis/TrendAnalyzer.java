package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.Outcome;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.model.TrendDirection;
import com.telemetrylens.core.model.TrendResult;
import com.telemetrylens.core.model.TrendSignificance;
import com.telemetrylens.core.stats.BaselineEstimator;

import java.util.List;
import java.util.Objects;

/**
 * Ordinary-least-squares trend over {@code (index, value)} pairs.
 *
 * <h3>Time axis</h3>
 * <p>
 * The x axis is the ordinal position of each present point, not elapsed
 * time, so the slope is "per bucket" and assumes buckets are evenly spaced.
 * With sparse or uneven buckets, gap-fill the series first (see
 * {@link GapFiller}) or interpret the slope per present point.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * A constant series has no variance to explain: it is reported as
 * {@code stable} with {@code low} significance and {@code R² = 0}.
 * </p>
 *
 * <h3>Strength</h3>
 * <p>
 * {@code strengthPct} is {@code |slope| / |mean| * 100}, so it stays
 * non-negative for series with a negative mean. It is {@code 0} when the
 * mean is {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalyzer {

    private TrendAnalyzer() {
        // utility class, not instantiable
    }

    public static Outcome<TrendResult> analyze(List<TimeSeriesPoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        return analyze(SeriesWindow.finiteValues(points));
    }

    /**
     * @param values series values in order
     * @return the fitted trend, or insufficient data below 2 values
     */
    public static Outcome<TrendResult> analyze(double[] values) {
        Objects.requireNonNull(values, "Series values must not be null");
        int n = values.length;
        if (n < 2) {
            return Outcome.insufficientData("Trend needs at least 2 points, got " + n);
        }

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double meanY = sumY / n;

        double ssTot = 0;
        for (double y : values) {
            ssTot += (y - meanY) * (y - meanY);
        }
        if (ssTot == 0) {
            return Outcome.ok(new TrendResult(0, meanY, 0, TrendDirection.STABLE, 0, TrendSignificance.LOW, n));
        }

        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;

        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double residual = values[i] - (intercept + slope * i);
            ssRes += residual * residual;
        }
        double rSquared = 1 - ssRes / ssTot;

        TrendDirection direction = slope > 0 ? TrendDirection.INCREASING
                : slope < 0 ? TrendDirection.DECREASING
                : TrendDirection.STABLE;
        double mean = BaselineEstimator.mean(values);
        double strengthPct = mean == 0 ? 0 : Math.abs(slope) / Math.abs(mean) * 100.0;

        return Outcome.ok(new TrendResult(slope, intercept, rSquared, direction, strengthPct,
                TrendSignificance.fromRSquared(rSquared), n));
    }
}
