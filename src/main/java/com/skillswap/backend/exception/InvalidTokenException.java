package com.skillswap.backend.exception;

/**
 * Bearer token failed signature or expiry checks
 */
public class InvalidTokenException extends BusinessException {
    public InvalidTokenException(String message) {
        super(message);
    }
}
