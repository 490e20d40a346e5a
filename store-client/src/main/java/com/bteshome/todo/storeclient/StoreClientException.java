package com.bteshome.todo.storeclient;

public class StoreClientException extends RuntimeException {
    public StoreClientException(String message) {
        super(message);
    }
    public StoreClientException(Throwable cause) {
        super(cause);
    }
    public StoreClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
