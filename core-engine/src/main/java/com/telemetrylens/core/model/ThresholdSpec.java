package com.telemetrylens.core.model;

import java.util.Objects;

/**
 * A derived decision boundary. Values strictly above {@link #getValue()}
 * are anomalous; when {@link #getLowerValue()} is present, values strictly
 * below it are anomalous drops.
 *
 * <p>
 * A boundary of {@link Double#POSITIVE_INFINITY} flags nothing; the policy
 * produces it for spread-based kinds over a baseline without spread.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdSpec {

    private final ThresholdKind kind;
    private final double value;
    private final Double lowerValue;
    private final String description;

    public ThresholdSpec(ThresholdKind kind, double value, String description) {
        this(kind, value, null, description);
    }

    public ThresholdSpec(ThresholdKind kind, double value, Double lowerValue, String description) {
        this.kind = Objects.requireNonNull(kind, "Threshold kind must not be null");
        this.value = value;
        this.lowerValue = lowerValue;
        this.description = description;
    }

    public ThresholdKind getKind() {
        return kind;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the lower boundary for two-sided checks, or {@code null}
     */
    public Double getLowerValue() {
        return lowerValue;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTwoSided() {
        return lowerValue != null;
    }

    @Override
    public String toString() {
        return "ThresholdSpec{" + kind.getLabel() + ": " + description + '}';
    }
}
