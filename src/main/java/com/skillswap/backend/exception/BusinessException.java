package com.skillswap.backend.exception;

/**
 * Base class for expected, client-facing failures.
 * Each subclass is mapped to an HTTP status in {@link GlobalExceptionHandler}.
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
