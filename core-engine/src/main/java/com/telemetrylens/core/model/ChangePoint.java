package com.telemetrylens.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A bucket at which the level or spread of a series shifted.
 *
 * <p>
 * {@code magnitude} is the relative mean shift for {@link ChangePointType#INCREASE}
 * and {@link ChangePointType#DECREASE}, and the stddev ratio for
 * {@link ChangePointType#VARIANCE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePoint {

    private final Instant timestamp;
    private final int index;
    private final ChangePointType type;
    private final double magnitude;
    private final double before;
    private final double after;

    public ChangePoint(Instant timestamp, int index, ChangePointType type,
            double magnitude, double before, double after) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.index = index;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.magnitude = magnitude;
        this.before = before;
        this.after = after;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getIndex() {
        return index;
    }

    public ChangePointType getType() {
        return type;
    }

    public double getMagnitude() {
        return magnitude;
    }

    /** Mean (or stddev, for variance changes) of the window before the point. */
    public double getBefore() {
        return before;
    }

    /** Mean (or stddev, for variance changes) of the window after the point. */
    public double getAfter() {
        return after;
    }

    @Override
    public String toString() {
        return "ChangePoint{" + type + " at " + timestamp + ", magnitude=" + magnitude + '}';
    }
}
