package com.bteshome.todo.todoservice.mapper;

public enum TodoOperation {
    LIST,
    CREATE,
    GET,
    UPDATE,
    DELETE
}
