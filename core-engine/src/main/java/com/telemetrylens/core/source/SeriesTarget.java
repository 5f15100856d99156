package com.telemetrylens.core.source;

import com.telemetrylens.core.error.InvalidParameterException;

import java.util.Objects;

/**
 * What a {@link SeriesSource} should bucket: a numeric field, a free-form
 * query, a log count, a log pattern count or the number of distinct values
 * of a log field.
 *
 * @since 1.0.0
 */
public final class SeriesTarget {

    /** Discriminator of the target. */
    public enum Kind {
        FIELD,
        QUERY,
        LOG_COUNT,
        LOG_PATTERN,
        LOG_CARDINALITY
    }

    private final Kind kind;
    private final String expression;

    private SeriesTarget(Kind kind, String expression) {
        this.kind = kind;
        this.expression = expression;
    }

    public static SeriesTarget field(String field) {
        return new SeriesTarget(Kind.FIELD, requireText(field, "Field name"));
    }

    public static SeriesTarget query(String query) {
        return new SeriesTarget(Kind.QUERY, requireText(query, "Query"));
    }

    /**
     * @param filter optional log filter; {@code null} counts every log record
     */
    public static SeriesTarget logCount(String filter) {
        return new SeriesTarget(Kind.LOG_COUNT, filter != null && !filter.isBlank() ? filter : null);
    }

    public static SeriesTarget logPattern(String pattern) {
        return new SeriesTarget(Kind.LOG_PATTERN, requireText(pattern, "Pattern"));
    }

    public static SeriesTarget logCardinality(String field) {
        return new SeriesTarget(Kind.LOG_CARDINALITY, requireText(field, "Field name"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return field name, query, filter or pattern; {@code null} only for an
     *         unfiltered log count
     */
    public String getExpression() {
        return expression;
    }

    /**
     * @return a stable label for reports and file lookups
     */
    public String label() {
        return switch (kind) {
            case FIELD, QUERY -> expression;
            case LOG_COUNT -> expression != null ? "logs:" + expression : "logs";
            case LOG_PATTERN -> "pattern:" + expression;
            case LOG_CARDINALITY -> "cardinality:" + expression;
        };
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException(what + " must not be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesTarget that))
            return false;
        return kind == that.kind && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expression);
    }

    @Override
    public String toString() {
        return kind + "(" + expression + ")";
    }
}
