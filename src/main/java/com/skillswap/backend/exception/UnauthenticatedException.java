package com.skillswap.backend.exception;

/**
 * No bearer token supplied
 */
public class UnauthenticatedException extends BusinessException {
    public UnauthenticatedException(String message) {
        super(message);
    }
}
