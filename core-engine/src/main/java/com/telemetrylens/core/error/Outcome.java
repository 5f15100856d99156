package com.telemetrylens.core.error;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of an analysis step: either a value or a categorised failure.
 *
 * <p>
 * Lets callers tell "not enough data" apart from "the source failed"
 * without catching exceptions. Instances are immutable.
 * </p>
 *
 * @param <T> type of the successful value
 * @since 1.0.0
 */
public final class Outcome<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String detail;

    private Outcome(T value, ErrorKind errorKind, String detail) {
        this.value = value;
        this.errorKind = errorKind;
        this.detail = detail;
    }

    /**
     * @param value the successful value; must not be {@code null}
     * @return a successful outcome
     */
    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "Outcome value must not be null"), null, null);
    }

    /**
     * @param kind   failure category; must not be {@code null}
     * @param detail human-readable diagnostic
     * @return a failed outcome
     */
    public static <T> Outcome<T> failure(ErrorKind kind, String detail) {
        return new Outcome<>(null, Objects.requireNonNull(kind, "ErrorKind must not be null"), detail);
    }

    public static <T> Outcome<T> insufficientData(String detail) {
        return failure(ErrorKind.INSUFFICIENT_DATA, detail);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    /**
     * @return the successful value
     * @throws NoSuchElementException if this outcome is a failure
     */
    public T getValue() {
        if (!isOk()) {
            throw new NoSuchElementException("Outcome is a failure (" + errorKind + "): " + detail);
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    /**
     * @return the failure category, or {@code null} for a successful outcome
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return the diagnostic message, or {@code null} for a successful outcome
     */
    public String getDetail() {
        return detail;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? Outcome.ok(mapper.apply(value)) : Outcome.failure(errorKind, detail);
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return isOk() ? mapper.apply(value) : Outcome.failure(errorKind, detail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Outcome<?> that))
            return false;
        return Objects.equals(value, that.value)
                && errorKind == that.errorKind
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, errorKind, detail);
    }

    @Override
    public String toString() {
        return isOk() ? "Outcome{ok=" + value + '}' : "Outcome{" + errorKind + ": " + detail + '}';
    }
}
