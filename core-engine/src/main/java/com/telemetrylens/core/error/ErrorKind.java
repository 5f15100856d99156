package com.telemetrylens.core.error;

/**
 * Failure categories an analysis call can report.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** A request parameter was missing or illegal. Raised before any fetch. */
    INVALID_PARAMETER,

    /** A window or series had too few usable points to compute anything. */
    INSUFFICIENT_DATA,

    /** The series could not be fetched from the data store. */
    SOURCE_UNAVAILABLE
}
