package com.bteshome.todo.storeclient.requests;

import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemDeleteRequest {
    private String table;
    private Map<String, String> key;
    private ConditionExpression condition;
}
