package com.bteshome.todo.todoservice.dto;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Getter
@Setter
public class TodoResponse {
    private String id;
    private String title;
    private String description;
}
