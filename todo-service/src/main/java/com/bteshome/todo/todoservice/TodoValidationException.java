package com.bteshome.todo.todoservice;

/**
 * A request rejected before it reaches the store.
 */
public class TodoValidationException extends TodoServiceException {
    public TodoValidationException(String message) {
        super(message);
    }
    public TodoValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
