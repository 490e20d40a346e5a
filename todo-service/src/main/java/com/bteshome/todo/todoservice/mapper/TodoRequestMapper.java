package com.bteshome.todo.todoservice.mapper;

import com.bteshome.todo.storeclient.requests.*;
import com.bteshome.todo.todoservice.TodoValidationException;
import com.bteshome.todo.todoservice.common.AppSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.util.Strings;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an HTTP request into exactly one store request.
 * <p>
 * Bodies are validated here, before anything is sent to the store. The key of an update or a
 * delete always comes from the path; an {@code id} in an update body is ignored. Creates carry
 * {@code attribute_not_exists} and updates and deletes carry {@code attribute_exists} on the
 * partition key, so the store rejects a create over an existing item and an update or delete
 * of a missing one.
 */
@Component
@RequiredArgsConstructor
public class TodoRequestMapper {
    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";

    private final AppSettings appSettings;
    private final ObjectMapper objectMapper;

    public ItemScanRequest toScanRequest() {
        return ItemScanRequest.builder()
                .table(appSettings.getTableName())
                .limit(appSettings.getScanLimit())
                .build();
    }

    public ItemPutRequest toCreateRequest(String body) {
        JsonNode todo = parseBody(body);
        String id = requiredString(todo, ID);
        String title = requiredString(todo, TITLE);
        String description = requiredString(todo, DESCRIPTION);

        return ItemPutRequest.builder()
                .table(appSettings.getTableName())
                .item(toItem(id, title, description))
                .condition(ConditionExpression.attributeNotExists(appSettings.getPartitionKey()))
                .build();
    }

    public ItemGetRequest toGetRequest(String todoId) {
        return ItemGetRequest.builder()
                .table(appSettings.getTableName())
                .key(toKey(todoId))
                .build();
    }

    public ItemPutRequest toUpdateRequest(String todoId, String body) {
        JsonNode todo = parseBody(body);
        String title = requiredString(todo, TITLE);
        String description = requiredString(todo, DESCRIPTION);

        return ItemPutRequest.builder()
                .table(appSettings.getTableName())
                .item(toItem(todoId, title, description))
                .condition(ConditionExpression.attributeExists(appSettings.getPartitionKey()))
                .build();
    }

    public ItemDeleteRequest toDeleteRequest(String todoId) {
        return ItemDeleteRequest.builder()
                .table(appSettings.getTableName())
                .key(toKey(todoId))
                .condition(ConditionExpression.attributeExists(appSettings.getPartitionKey()))
                .build();
    }

    private JsonNode parseBody(String body) {
        if (Strings.isBlank(body))
            throw new TodoValidationException("Request body is required.");

        JsonNode root;
        try {
            root = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(body);
        } catch (JsonProcessingException e) {
            throw new TodoValidationException("Request body is not valid JSON.", e);
        }

        if (root == null || !root.isObject())
            throw new TodoValidationException("Request body must be a JSON object.");

        return root;
    }

    private static String requiredString(JsonNode todo, String field) {
        JsonNode value = todo.get(field);

        if (value == null || value.isNull())
            throw new TodoValidationException("'%s' is required.".formatted(field));
        if (!value.isTextual())
            throw new TodoValidationException("'%s' must be a string.".formatted(field));
        if (value.textValue().isEmpty())
            throw new TodoValidationException("'%s' cannot be empty.".formatted(field));

        return value.textValue();
    }

    private Map<String, String> toItem(String id, String title, String description) {
        Map<String, String> item = new LinkedHashMap<>();
        item.put(appSettings.getPartitionKey(), id);
        item.put(TITLE, title);
        item.put(DESCRIPTION, description);
        return item;
    }

    private Map<String, String> toKey(String todoId) {
        return Map.of(appSettings.getPartitionKey(), todoId);
    }
}
