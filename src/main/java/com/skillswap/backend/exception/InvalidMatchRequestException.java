package com.skillswap.backend.exception;

/**
 * Match request that can never be valid, e.g. addressed to oneself
 */
public class InvalidMatchRequestException extends BusinessException {
    public InvalidMatchRequestException(String message) {
        super(message);
    }
}
