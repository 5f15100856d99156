package com.telemetrylens.core.error;

/**
 * Thrown when a {@link com.telemetrylens.core.source.SeriesSource} fails to
 * deliver a series.
 *
 * <p>
 * The engine never retries; retries belong to the source adapter.
 * </p>
 *
 * @since 1.0.0
 */
public class SourceUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind getErrorKind() {
        return ErrorKind.SOURCE_UNAVAILABLE;
    }
}
