package com.bteshome.todo.todoservice.mapper;

public enum OutcomeType {
    SUCCESS,
    CONDITIONAL_CHECK_FAILED,
    FAILURE,
    UNCLASSIFIED
}
