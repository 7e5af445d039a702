package com.skillswap.backend.exception;

/**
 * Lookup completed but produced nothing to return
 */
public class NotFoundResultException extends BusinessException {
    public NotFoundResultException(String message) {
        super(message);
    }
}
