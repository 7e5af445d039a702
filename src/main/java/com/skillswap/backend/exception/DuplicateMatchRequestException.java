package com.skillswap.backend.exception;

/**
 * A pending request already exists for the sender/receiver pair
 */
public class DuplicateMatchRequestException extends BusinessException {
    public DuplicateMatchRequestException(String message) {
        super(message);
    }
}
