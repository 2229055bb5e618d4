package com.majordome.exception;

/**
 * Base exception for the Majordome engine.
 */
public class MajordomeException extends RuntimeException {

    public MajordomeException(String message) {
        super(message);
    }

    public MajordomeException(String message, Throwable cause) {
        super(message, cause);
    }
}
