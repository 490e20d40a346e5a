package com.bteshome.todo.todoservice;

public class TodoServiceException extends RuntimeException {
    public TodoServiceException(String message) {
        super(message);
    }
    public TodoServiceException(Throwable cause) {
        super(cause);
    }
    public TodoServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
