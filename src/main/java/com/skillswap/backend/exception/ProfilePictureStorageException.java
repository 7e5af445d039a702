package com.skillswap.backend.exception;

/**
 * Uploaded profile picture could not be stored
 */
public class ProfilePictureStorageException extends BusinessException {
    public ProfilePictureStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
