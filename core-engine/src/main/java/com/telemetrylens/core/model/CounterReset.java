package com.telemetrylens.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A counter bucket whose value went down; its rate was not computed.
 *
 * @since 1.0.0
 */
public final class CounterReset {

    private final Instant timestamp;
    private final double fromValue;
    private final double toValue;

    public CounterReset(Instant timestamp, double fromValue, double toValue) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.fromValue = fromValue;
        this.toValue = toValue;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getFromValue() {
        return fromValue;
    }

    public double getToValue() {
        return toValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CounterReset that))
            return false;
        return timestamp.equals(that.timestamp)
                && Double.compare(fromValue, that.fromValue) == 0
                && Double.compare(toValue, that.toValue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, fromValue, toValue);
    }

    @Override
    public String toString() {
        return "CounterReset{" + timestamp + ": " + fromValue + " -> " + toValue + '}';
    }
}
