package com.micemail.exception;

/**
 * Recipient store read or write failure
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
