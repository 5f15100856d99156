package com.telemetrylens.core.stats;

import com.telemetrylens.core.error.InvalidParameterException;
import com.telemetrylens.core.model.BaselineStats;
import com.telemetrylens.core.model.MetricKind;
import com.telemetrylens.core.model.ThresholdKind;
import com.telemetrylens.core.model.ThresholdSpec;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps baseline statistics, a threshold kind and its parameter to a
 * decision boundary.
 *
 * <h3>Boundaries</h3>
 * <ul>
 * <li>{@code zscore}, {@code rateOfChange}: {@code mean + k * stddev}</li>
 * <li>{@code percentile}: the baseline value at rank {@code p}</li>
 * <li>{@code mad}: {@code median + k * 1.4826 * MAD}</li>
 * <li>{@code iqr}: {@code q3 + k * IQR}</li>
 * <li>{@code fixed}: the supplied value</li>
 * </ul>
 *
 * <p>
 * Spread-based kinds return {@link Double#POSITIVE_INFINITY} when the
 * baseline spread is zero, so a constant baseline never flags anything.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdPolicy {

    /** Scales MAD to a stddev estimate under normality. */
    public static final double MAD_SCALE = 1.4826;

    private ThresholdPolicy() {
        // utility class, not instantiable
    }

    /**
     * Reject a kind/parameter combination before any data is fetched.
     *
     * @throws InvalidParameterException listing every problem found
     */
    public static void validate(ThresholdKind kind, Double parameter, MetricKind metricKind) {
        Objects.requireNonNull(kind, "Threshold kind must not be null");
        List<String> errors = kind.parameterErrors(parameter, metricKind);
        if (!errors.isEmpty()) {
            throw new InvalidParameterException(String.join("; ", errors));
        }
    }

    /**
     * @return {@code parameter}, or the kind's default when it is {@code null}
     * @throws InvalidParameterException for {@code fixed} without a value
     */
    public static double resolveParameter(ThresholdKind kind, Double parameter) {
        if (parameter != null) {
            return parameter;
        }
        if (!kind.hasDefault()) {
            throw new InvalidParameterException("Threshold kind '" + kind.getLabel() + "' requires a value");
        }
        return kind.getDefaultParameter();
    }

    /**
     * Derive an upper boundary.
     *
     * @param stats     baseline statistics; must not be {@code null}
     * @param kind      threshold kind; must not be {@code null}
     * @param parameter multiplier, rank or value; {@code null} for the default
     */
    public static ThresholdSpec derive(BaselineStats stats, ThresholdKind kind, Double parameter) {
        Objects.requireNonNull(stats, "Baseline stats must not be null");
        Objects.requireNonNull(kind, "Threshold kind must not be null");
        double p = resolveParameter(kind, parameter);
        double upper = upper(stats, kind, p);
        return new ThresholdSpec(kind, upper, describe(kind, p, upper));
    }

    /**
     * Derive an upper boundary and its mirrored lower boundary. {@code fixed}
     * stays one-sided.
     */
    public static ThresholdSpec deriveTwoSided(BaselineStats stats, ThresholdKind kind, Double parameter) {
        ThresholdSpec upper = derive(stats, kind, parameter);
        if (kind == ThresholdKind.FIXED) {
            return upper;
        }
        double p = resolveParameter(kind, parameter);
        double lower = lower(stats, kind, p);
        return new ThresholdSpec(kind, upper.getValue(), lower, upper.getDescription());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double upper(BaselineStats stats, ThresholdKind kind, double p) {
        return switch (kind) {
            case ZSCORE, RATE_OF_CHANGE -> stats.getStddev() == 0
                    ? Double.POSITIVE_INFINITY
                    : stats.getMean() + p * stats.getStddev();
            case PERCENTILE -> stats.percentile(p);
            case MAD -> stats.getMad() == 0
                    ? Double.POSITIVE_INFINITY
                    : stats.getMedian() + p * MAD_SCALE * stats.getMad();
            case IQR -> stats.getIqr() == 0
                    ? Double.POSITIVE_INFINITY
                    : stats.getQ3() + p * stats.getIqr();
            case FIXED -> p;
        };
    }

    private static double lower(BaselineStats stats, ThresholdKind kind, double p) {
        return switch (kind) {
            case ZSCORE, RATE_OF_CHANGE -> stats.getStddev() == 0
                    ? Double.NEGATIVE_INFINITY
                    : stats.getMean() - p * stats.getStddev();
            case PERCENTILE -> stats.percentile(100.0 - p);
            case MAD -> stats.getMad() == 0
                    ? Double.NEGATIVE_INFINITY
                    : stats.getMedian() - p * MAD_SCALE * stats.getMad();
            case IQR -> stats.getIqr() == 0
                    ? Double.NEGATIVE_INFINITY
                    : stats.getQ1() - p * stats.getIqr();
            case FIXED -> Double.NEGATIVE_INFINITY;
        };
    }

    static String describe(ThresholdKind kind, double p, double value) {
        String v = Double.isInfinite(value) ? "none, baseline has no spread" : format(value);
        String k = format(p).replaceAll("\\.00$", "");
        return switch (kind) {
            case ZSCORE -> "mean + " + k + " stddev (" + v + ")";
            case RATE_OF_CHANGE -> "rate mean + " + k + " stddev (" + v + (Double.isInfinite(value) ? ")" : "/s)");
            case PERCENTILE -> k + "th percentile (" + v + ")";
            case MAD -> "median + " + k + " MAD (" + v + ")";
            case IQR -> "q3 + " + k + " IQR (" + v + ")";
            case FIXED -> "fixed value (" + v + ")";
        };
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
