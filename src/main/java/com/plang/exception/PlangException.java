package com.plang.exception;

/**
 * Base exception for the PLang policy core.
 */
public class PlangException extends RuntimeException {

    public PlangException(String message) {
        super(message);
    }

    public PlangException(String message, Throwable cause) {
        super(message, cause);
    }
}
