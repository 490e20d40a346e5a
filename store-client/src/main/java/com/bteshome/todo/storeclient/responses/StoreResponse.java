package com.bteshome.todo.storeclient.responses;

public interface StoreResponse {
    int getHttpStatusCode();

    String getErrorCode();

    String getErrorMessage();

    default boolean isConditionalCheckFailed() {
        return ErrorCode.CONDITIONAL_CHECK_FAILED.equals(getErrorCode());
    }
}
