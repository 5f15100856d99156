package com.telemetrylens.core.error;

/**
 * Thrown synchronously when an analysis request or rule is invalid.
 *
 * <p>
 * Always fatal to the call, and always raised before the series is fetched.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }

    public ErrorKind getErrorKind() {
        return ErrorKind.INVALID_PARAMETER;
    }
}
