package com.majordome.exception;

/**
 * Exception thrown when configuration or a household description is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends MajordomeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
