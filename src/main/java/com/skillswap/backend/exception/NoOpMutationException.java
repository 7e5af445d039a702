package com.skillswap.backend.exception;

/**
 * A mutation affected no rows
 */
public class NoOpMutationException extends BusinessException {
    public NoOpMutationException(String message) {
        super(message);
    }
}
