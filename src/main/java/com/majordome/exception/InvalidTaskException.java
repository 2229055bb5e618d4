package com.majordome.exception;

/**
 * Exception thrown when a task snapshot cannot be built from its inputs,
 * e.g. a negative recurrence interval or a malformed weekday token.
 * Raised before the task ever reaches the evaluator.
 */
public class InvalidTaskException extends MajordomeException {

    public InvalidTaskException(String message) {
        super(message);
    }

    public InvalidTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
