package com.bteshome.todo.storeclient;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "store")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class StoreSettings {
    private StoreType type = StoreType.MEMORY;
    private String region;
    private String endpointOverride;
    // table name -> partition key attribute, only used by the in-memory store
    private Map<String, String> memoryTables = new HashMap<>();

    public void print() {
        log.info("StoreSettings: type={}", type);
        log.info("StoreSettings: region={}", region);
        log.info("StoreSettings: endpointOverride={}", endpointOverride);
        log.info("StoreSettings: memoryTables={}", memoryTables);
    }
}
