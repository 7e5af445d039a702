package com.skillswap.backend.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure carrying one message per offending request field, so clients can
 * render each error next to its input.
 */
public abstract class FieldErrorsException extends BusinessException {

    private final Map<String, String> fieldErrors;

    protected FieldErrorsException(String message, Map<String, String> fieldErrors) {
        super(message);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
