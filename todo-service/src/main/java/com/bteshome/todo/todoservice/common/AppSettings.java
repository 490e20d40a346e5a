package com.bteshome.todo.todoservice.common;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "todo")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class AppSettings {
    private String tableName = "todos";
    private String partitionKey = "id";
    private int scanLimit = 10;

    public void print() {
        log.info("AppSettings: tableName={}", tableName);
        log.info("AppSettings: partitionKey={}", partitionKey);
        log.info("AppSettings: scanLimit={}", scanLimit);
    }
}
