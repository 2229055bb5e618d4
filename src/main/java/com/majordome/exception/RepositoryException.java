package com.majordome.exception;

/**
 * Exception thrown when the task repository cannot be read or written.
 * There is no safe default for a missing catalog, so this aborts the ranking request.
 */
public class RepositoryException extends MajordomeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
