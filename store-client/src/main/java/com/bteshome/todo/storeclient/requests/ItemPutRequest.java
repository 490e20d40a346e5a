package com.bteshome.todo.storeclient.requests;

import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemPutRequest {
    private String table;
    private Map<String, String> item;
    private ConditionExpression condition;
}
