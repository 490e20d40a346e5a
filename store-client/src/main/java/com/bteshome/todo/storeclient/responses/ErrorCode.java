package com.bteshome.todo.storeclient.responses;

public class ErrorCode {
    public static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailedException";
    public static final String RESOURCE_NOT_FOUND = "ResourceNotFoundException";
    public static final String VALIDATION = "ValidationException";

    private ErrorCode() {
    }
}
