package com.telemetrylens.core.model;

import com.telemetrylens.core.error.InvalidParameterException;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact interval strings such as {@code 30s}, {@code 5m},
 * {@code 1h}, {@code 1d} or {@code 1w}.
 *
 * @since 1.0.0
 */
public final class Intervals {

    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)\\s*(s|m|h|d|w)$");

    private Intervals() {
        // utility class, not instantiable
    }

    /**
     * @param text interval text; case-insensitive
     * @return the positive duration it denotes
     * @throws InvalidParameterException if the text is blank, malformed, zero or
     *         too large for a {@link Duration}
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidParameterException("Interval must not be blank");
        }
        Matcher m = INTERVAL.matcher(text.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new InvalidParameterException("Invalid interval: '" + text
                    + "'. Expected <number><s|m|h|d|w>, e.g. 5m");
        }
        try {
            long amount = Long.parseLong(m.group(1));
            if (amount <= 0) {
                throw new InvalidParameterException("Interval must be positive, got: '" + text + "'");
            }
            return switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> Duration.ofDays(Math.multiplyExact(amount, 7L));
            };
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidParameterException("Interval out of range: '" + text + "'");
        }
    }

    /**
     * Like {@link #parse(String)} but returns {@code null} instead of throwing,
     * for validation code that reports problems in bulk.
     */
    static Duration tryParse(String text) {
        try {
            return parse(text);
        } catch (InvalidParameterException e) {
            return null;
        }
    }
}
