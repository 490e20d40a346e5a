package com.bteshome.todo.storeclient.responses;

import lombok.*;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemScanResponse implements StoreResponse {
    private int httpStatusCode;
    private String errorCode;
    private String errorMessage;
    private List<Map<String, String>> items;
}
