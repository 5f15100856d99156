package com.telemetrylens.core.analysis;

import com.telemetrylens.core.model.SeasonalPattern;
import com.telemetrylens.core.model.SeriesWindow;
import com.telemetrylens.core.model.TimeSeriesPoint;
import com.telemetrylens.core.stats.BaselineEstimator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Periodicity detection from the autocorrelation function.
 *
 * <p>
 * {@code acf(lag)} is computed for lags {@code 1..floor(n/2)} with the
 * whole-series sum of squares as denominator. A lag is a peak when it is
 * above both neighbours (boundary lags: above their single neighbour) and
 * above {@value #MIN_AUTOCORRELATION}. At most {@value #MAX_PATTERNS} peaks
 * are returned, strongest first.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalityAnalyzer {

    public static final double MIN_AUTOCORRELATION = 0.3;
    public static final int MAX_PATTERNS = 3;

    private SeasonalityAnalyzer() {
        // utility class, not instantiable
    }

    public static List<SeasonalPattern> detect(List<TimeSeriesPoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        return detect(SeriesWindow.finiteValues(points));
    }

    /**
     * @return detected periods, empty for short or constant series
     */
    public static List<SeasonalPattern> detect(double[] values) {
        double[] acf = autocorrelation(values);
        int maxLag = acf.length - 1;
        List<SeasonalPattern> peaks = new ArrayList<>();
        for (int lag = 1; lag <= maxLag; lag++) {
            double v = acf[lag];
            if (v <= MIN_AUTOCORRELATION) {
                continue;
            }
            boolean aboveLeft = lag == 1 || v > acf[lag - 1];
            boolean aboveRight = lag == maxLag || v > acf[lag + 1];
            if (aboveLeft && aboveRight) {
                peaks.add(new SeasonalPattern(lag, v));
            }
        }
        peaks.sort(Comparator.comparingDouble(SeasonalPattern::getAutocorrelation).reversed()
                .thenComparingInt(SeasonalPattern::getLag));
        return peaks.size() > MAX_PATTERNS ? List.copyOf(peaks.subList(0, MAX_PATTERNS)) : List.copyOf(peaks);
    }

    /**
     * @param values series values in order
     * @return array indexed by lag; index 0 is {@code 1.0} and the last index
     *         is {@code floor(n/2)}. Only index 0 exists when the series is
     *         constant or shorter than 2 values.
     */
    public static double[] autocorrelation(double[] values) {
        Objects.requireNonNull(values, "Series values must not be null");
        int n = values.length;
        double mean = n > 0 ? BaselineEstimator.mean(values) : 0;
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        if (n < 2 || denominator == 0) {
            return new double[] {1.0};
        }

        int maxLag = n / 2;
        double[] acf = new double[maxLag + 1];
        acf[0] = 1.0;
        for (int lag = 1; lag <= maxLag; lag++) {
            double numerator = 0;
            for (int i = 0; i < n - lag; i++) {
                numerator += (values[i] - mean) * (values[i + lag] - mean);
            }
            acf[lag] = numerator / denominator;
        }
        return acf;
    }
}
