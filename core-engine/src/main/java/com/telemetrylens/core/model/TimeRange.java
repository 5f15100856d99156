package com.telemetrylens.core.model;

import com.telemetrylens.core.error.InvalidParameterException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open instant range {@code [start, end)}.
 *
 * @since 1.0.0
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    /**
     * @throws InvalidParameterException if {@code start} is not before {@code end}
     */
    public TimeRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "Range start must not be null");
        this.end = Objects.requireNonNull(end, "Range end must not be null");
        if (!start.isBefore(end)) {
            throw new InvalidParameterException(
                    "Time range start must be before end, got: [" + start + ", " + end + ")");
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    /**
     * Range of the given length ending at {@code end}.
     */
    public static TimeRange lastBefore(Instant end, Duration length) {
        return new TimeRange(end.minus(length), end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * @return a range that starts {@code lookback} earlier and has the same end
     */
    public TimeRange extendBack(Duration lookback) {
        return new TimeRange(start.minus(lookback), end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
