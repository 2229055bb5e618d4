package com.majordome.exception;

/**
 * Exception thrown when a task, or the room it is looked up in, is unknown.
 */
public class TaskNotFoundException extends MajordomeException {

    public TaskNotFoundException(String message) {
        super(message);
    }
}
