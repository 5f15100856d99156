package com.telemetrylens.core.analysis;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.SmoothingMethod;

import java.util.Objects;

/**
 * Moving-average smoothing of a value array.
 *
 * <ul>
 * <li>{@code SMA}: centred window {@code [i - floor(w/2), i + ceil(w/2))},
 * clipped at the ends</li>
 * <li>{@code EMA}: {@code alpha = 2 / (w + 1)}, seeded with the first value</li>
 * </ul>
 *
 * A series shorter than the window is returned unchanged.
 */
public final class Smoother {

    public static final int DEFAULT_WINDOW = 5;

    private Smoother() {
        // utility class, not instantiable
    }

    /**
     * @return a new array; the input is never modified
     * @throws InvalidParameterException if {@code window < 1}
     */
    public static double[] smooth(double[] values, SmoothingMethod method, int window) {
        Objects.requireNonNull(values, "Series values must not be null");
        Objects.requireNonNull(method, "Smoothing method must not be null");
        if (window < 1) {
            throw new InvalidParameterException("Smoothing window must be >= 1, got: " + window);
        }
        if (method == SmoothingMethod.NONE || values.length < window) {
            return values.clone();
        }
        return method == SmoothingMethod.SMA ? simple(values, window) : exponential(values, window);
    }

    private static double[] simple(double[] values, int window) {
        int n = values.length;
        int before = window / 2;
        int after = window - before;
        double[] smoothed = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(n, i + after);
            double sum = 0;
            for (int j = from; j < to; j++) {
                sum += values[j];
            }
            smoothed[i] = sum / (to - from);
        }
        return smoothed;
    }

    private static double[] exponential(double[] values, int window) {
        double alpha = 2.0 / (window + 1);
        double[] smoothed = new double[values.length];
        smoothed[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            smoothed[i] = alpha * values[i] + (1 - alpha) * smoothed[i - 1];
        }
        return smoothed;
    }
}
