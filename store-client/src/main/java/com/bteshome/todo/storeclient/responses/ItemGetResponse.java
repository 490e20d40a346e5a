package com.bteshome.todo.storeclient.responses;

import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemGetResponse implements StoreResponse {
    private int httpStatusCode;
    private String errorCode;
    private String errorMessage;
    // null when no item exists for the key
    private Map<String, String> item;
}
