package com.bteshome.todo.storeclient.requests;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemScanRequest {
    private String table;
    private int limit;
}
