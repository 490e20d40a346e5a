package com.bteshome.todo.storeclient.memory;

import com.bteshome.todo.storeclient.StoreClient;
import com.bteshome.todo.storeclient.StoreClientException;
import com.bteshome.todo.storeclient.StoreSettings;
import com.bteshome.todo.storeclient.requests.*;
import com.bteshome.todo.storeclient.responses.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store held in process memory, one concurrent map per table keyed by the partition key value.
 * Conditions are checked inside {@link ConcurrentHashMap#compute}, so the check and the write
 * are atomic for a given key.
 */
@Component
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryStoreClient implements StoreClient {
    private final Map<String, TableState> tables = new ConcurrentHashMap<>();

    private record TableState(String partitionKey, Map<String, Map<String, String>> items) {}

    public InMemoryStoreClient(StoreSettings storeSettings) {
        storeSettings.getMemoryTables().forEach(this::createTable);
    }

    public void createTable(String table, String partitionKey) {
        if (table == null || table.isBlank() || partitionKey == null || partitionKey.isBlank())
            throw new StoreClientException("Table name and partition key are required.");

        if (tables.putIfAbsent(table, new TableState(partitionKey, new ConcurrentHashMap<>())) == null)
            log.info("Created in-memory table '{}' with partition key '{}'.", table, partitionKey);
    }

    @Override
    public Mono<ItemScanResponse> scan(ItemScanRequest request) {
        return Mono.fromSupplier(() -> {
            TableState tableState = tables.get(request.getTable());

            if (tableState == null) {
                return ItemScanResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.RESOURCE_NOT_FOUND)
                        .errorMessage(tableNotFound(request.getTable()))
                        .build();
            }

            if (request.getLimit() < 1) {
                return ItemScanResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.VALIDATION)
                        .errorMessage("Limit must be greater than zero.")
                        .build();
            }

            List<Map<String, String>> items = tableState.items()
                    .values()
                    .stream()
                    .limit(request.getLimit())
                    .map(item -> Collections.unmodifiableMap(new LinkedHashMap<>(item)))
                    .toList();

            log.debug("Scanned '{}' items from table '{}'.", items.size(), request.getTable());

            return ItemScanResponse.builder()
                    .httpStatusCode(HttpStatus.OK.value())
                    .items(items)
                    .build();
        });
    }

    @Override
    public Mono<ItemPutResponse> putItem(ItemPutRequest request) {
        return Mono.fromSupplier(() -> {
            TableState tableState = tables.get(request.getTable());

            if (tableState == null) {
                return ItemPutResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.RESOURCE_NOT_FOUND)
                        .errorMessage(tableNotFound(request.getTable()))
                        .build();
            }

            String validationError = validateItem(request.getItem(), tableState.partitionKey());
            if (validationError != null) {
                return ItemPutResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.VALIDATION)
                        .errorMessage(validationError)
                        .build();
            }

            String keyValue = request.getItem().get(tableState.partitionKey());
            Map<String, String> newItem = Collections.unmodifiableMap(new LinkedHashMap<>(request.getItem()));
            AtomicBoolean conditionFailed = new AtomicBoolean(false);

            tableState.items().compute(keyValue, (key, existingItem) -> {
                if (request.getCondition() != null && !request.getCondition().isSatisfiedBy(existingItem)) {
                    conditionFailed.set(true);
                    return existingItem;
                }
                return newItem;
            });

            if (conditionFailed.get()) {
                log.debug("PUT of key '{}' to table '{}' rejected, condition '{}' not met.", keyValue, request.getTable(), request.getCondition());
                return ItemPutResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.CONDITIONAL_CHECK_FAILED)
                        .errorMessage("The conditional request failed")
                        .build();
            }

            log.debug("Put key '{}' to table '{}'.", keyValue, request.getTable());

            return ItemPutResponse.builder()
                    .httpStatusCode(HttpStatus.OK.value())
                    .build();
        });
    }

    @Override
    public Mono<ItemGetResponse> getItem(ItemGetRequest request) {
        return Mono.fromSupplier(() -> {
            TableState tableState = tables.get(request.getTable());

            if (tableState == null) {
                return ItemGetResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.RESOURCE_NOT_FOUND)
                        .errorMessage(tableNotFound(request.getTable()))
                        .build();
            }

            String validationError = validateKey(request.getKey(), tableState.partitionKey());
            if (validationError != null) {
                return ItemGetResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.VALIDATION)
                        .errorMessage(validationError)
                        .build();
            }

            Map<String, String> item = tableState.items().get(request.getKey().get(tableState.partitionKey()));

            return ItemGetResponse.builder()
                    .httpStatusCode(HttpStatus.OK.value())
                    .item(item)
                    .build();
        });
    }

    @Override
    public Mono<ItemDeleteResponse> deleteItem(ItemDeleteRequest request) {
        return Mono.fromSupplier(() -> {
            TableState tableState = tables.get(request.getTable());

            if (tableState == null) {
                return ItemDeleteResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.RESOURCE_NOT_FOUND)
                        .errorMessage(tableNotFound(request.getTable()))
                        .build();
            }

            String validationError = validateKey(request.getKey(), tableState.partitionKey());
            if (validationError != null) {
                return ItemDeleteResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.VALIDATION)
                        .errorMessage(validationError)
                        .build();
            }

            String keyValue = request.getKey().get(tableState.partitionKey());
            AtomicBoolean conditionFailed = new AtomicBoolean(false);

            tableState.items().compute(keyValue, (key, existingItem) -> {
                if (request.getCondition() != null && !request.getCondition().isSatisfiedBy(existingItem)) {
                    conditionFailed.set(true);
                    return existingItem;
                }
                return null;
            });

            if (conditionFailed.get()) {
                log.debug("DELETE of key '{}' from table '{}' rejected, condition '{}' not met.", keyValue, request.getTable(), request.getCondition());
                return ItemDeleteResponse.builder()
                        .httpStatusCode(HttpStatus.BAD_REQUEST.value())
                        .errorCode(ErrorCode.CONDITIONAL_CHECK_FAILED)
                        .errorMessage("The conditional request failed")
                        .build();
            }

            log.debug("Deleted key '{}' from table '{}'.", keyValue, request.getTable());

            return ItemDeleteResponse.builder()
                    .httpStatusCode(HttpStatus.OK.value())
                    .build();
        });
    }

    private static String validateItem(Map<String, String> item, String partitionKey) {
        if (item == null || item.isEmpty())
            return "Item is required.";
        if (item.entrySet().stream().anyMatch(entry -> entry.getKey() == null || entry.getValue() == null))
            return "Item attribute names and values cannot be null.";
        return validateKeyValue(item.get(partitionKey), partitionKey);
    }

    private static String validateKey(Map<String, String> key, String partitionKey) {
        if (key == null || key.size() != 1 || !key.containsKey(partitionKey))
            return "The provided key element does not match the schema.";
        return validateKeyValue(key.get(partitionKey), partitionKey);
    }

    private static String validateKeyValue(String keyValue, String partitionKey) {
        if (keyValue == null)
            return "Missing the key %s in the item.".formatted(partitionKey);
        if (keyValue.isEmpty())
            return "The key %s cannot be an empty string.".formatted(partitionKey);
        return null;
    }

    private static String tableNotFound(String table) {
        return "Requested resource not found: Table: %s not found".formatted(table);
    }
}
