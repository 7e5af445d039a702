package com.skillswap.backend.exception;

import java.util.Map;

/**
 * Unique value (username, email) already taken
 */
public class DuplicateFieldException extends FieldErrorsException {
    public DuplicateFieldException(Map<String, String> fieldErrors) {
        super("Duplicate value", fieldErrors);
    }

    public DuplicateFieldException(String message, Map<String, String> fieldErrors) {
        super(message, fieldErrors);
    }
}
