package com.bteshome.todo.todoservice;

/**
 * A store response whose status is neither in the success nor in the client error family.
 */
public class UnclassifiedOutcomeException extends TodoServiceException {
    public UnclassifiedOutcomeException(String message) {
        super(message);
    }
}
