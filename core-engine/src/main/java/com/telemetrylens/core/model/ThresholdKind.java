package com.telemetrylens.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.telemetrylens.core.error.InvalidParameterException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How a decision boundary is derived from baseline statistics.
 *
 * @since 1.0.0
 */
public enum ThresholdKind {

    /** {@code mean + k * stddev}. */
    ZSCORE("zscore", 3.0),

    /** {@code percentile(baseline, p)}. */
    PERCENTILE("percentile", 99.0),

    /** {@code median + k * 1.4826 * MAD}. */
    MAD("mad", 3.0),

    /** Caller-supplied absolute value; there is no default. */
    FIXED("fixed", Double.NaN),

    /** Z-score math over the per-second rate of a counter. */
    RATE_OF_CHANGE("rateOfChange", 3.0),

    /** {@code q3 + k * IQR}. */
    IQR("iqr", 1.5);

    private final String label;
    private final double defaultParameter;

    ThresholdKind(String label, double defaultParameter) {
        this.label = label;
        this.defaultParameter = defaultParameter;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @return the multiplier or rank used when the caller supplies none;
     *         {@code NaN} for {@link #FIXED}
     */
    public double getDefaultParameter() {
        return defaultParameter;
    }

    public boolean hasDefault() {
        return !Double.isNaN(defaultParameter);
    }

    /**
     * Check a caller-supplied parameter against this kind.
     *
     * @param parameter  multiplier, rank or absolute value; {@code null} means
     *                   "use the default"
     * @param metricKind shape of the series the threshold applies to
     * @return every problem found; empty when the combination is valid
     */
    public List<String> parameterErrors(Double parameter, MetricKind metricKind) {
        List<String> errors = new ArrayList<>();
        if (this == FIXED && parameter == null) {
            errors.add("Threshold kind 'fixed' requires a value");
        }
        if (this == RATE_OF_CHANGE && metricKind != MetricKind.COUNTER) {
            errors.add("Threshold kind 'rateOfChange' is only valid for counter metrics, got: "
                    + (metricKind != null ? metricKind.name().toLowerCase(Locale.ROOT) : "none"));
        }
        if (parameter != null) {
            if (!Double.isFinite(parameter)) {
                errors.add("Threshold value must be finite, got: " + parameter);
            } else if (this == PERCENTILE && (parameter <= 0 || parameter > 100)) {
                errors.add("Percentile rank must be in (0, 100], got: " + parameter);
            } else if (this != FIXED && this != PERCENTILE && parameter <= 0) {
                errors.add("Multiplier for '" + label + "' must be > 0, got: " + parameter);
            }
        }
        return errors;
    }

    /**
     * Parse a kind leniently: case, dashes and underscores are ignored, so
     * {@code rateOfChange}, {@code rate-of-change} and {@code RATE_OF_CHANGE}
     * are all accepted.
     *
     * @throws InvalidParameterException if the name matches no kind
     */
    public static ThresholdKind fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidParameterException("Threshold kind must not be blank");
        }
        String normalized = normalize(name);
        for (ThresholdKind kind : values()) {
            if (normalize(kind.label).equals(normalized) || normalize(kind.name()).equals(normalized)) {
                return kind;
            }
        }
        throw new InvalidParameterException("Unknown threshold kind: '" + name
                + "'. Supported: zscore, percentile, mad, fixed, rateOfChange, iqr");
    }

    private static String normalize(String s) {
        return s.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
