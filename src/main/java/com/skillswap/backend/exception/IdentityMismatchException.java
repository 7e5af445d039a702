package com.skillswap.backend.exception;

/**
 * Request names an acting user other than the authenticated one
 */
public class IdentityMismatchException extends BusinessException {
    public IdentityMismatchException(String message) {
        super(message);
    }
}
