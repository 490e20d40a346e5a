package com.bteshome.todo.storeclient.responses;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemPutResponse implements StoreResponse {
    private int httpStatusCode;
    private String errorCode;
    private String errorMessage;
}
