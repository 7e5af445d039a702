package com.skillswap.backend.exception;

import java.util.Map;

/**
 * Sign-in rejected; field errors tell apart unknown username and wrong password
 */
public class InvalidCredentialsException extends FieldErrorsException {
    public InvalidCredentialsException(Map<String, String> fieldErrors) {
        super("Invalid credentials", fieldErrors);
    }
}
