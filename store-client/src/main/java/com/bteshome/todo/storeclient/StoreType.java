package com.bteshome.todo.storeclient;

public enum StoreType {
    MEMORY,
    DYNAMODB
}
