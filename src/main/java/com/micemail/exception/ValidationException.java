package com.micemail.exception;

/**
 * Rejected request content; surfaced to the caller as 400
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
