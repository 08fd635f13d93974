package com.geoshard.infrastructure.exception;

/**
 * Base class for unexpected failures that carry a stable error code.
 */
public class GeoshardException extends RuntimeException {

    private final String errorCode;

    public GeoshardException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GeoshardException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
