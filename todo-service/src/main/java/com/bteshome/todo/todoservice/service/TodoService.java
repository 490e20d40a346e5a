package com.bteshome.todo.todoservice.service;

import com.bteshome.todo.storeclient.StoreClient;
import com.bteshome.todo.storeclient.requests.*;
import com.bteshome.todo.storeclient.responses.*;
import com.bteshome.todo.todoservice.TodoValidationException;
import com.bteshome.todo.todoservice.mapper.TodoOperation;
import com.bteshome.todo.todoservice.mapper.TodoRequestMapper;
import com.bteshome.todo.todoservice.mapper.TodoResponseMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class TodoService {
    private final StoreClient storeClient;
    private final TodoRequestMapper requestMapper;
    private final TodoResponseMapper responseMapper;

    public ResponseEntity<?> getAll() {
        try {
            ItemScanRequest request = requestMapper.toScanRequest();
            log.debug("Listing up to {} todos.", request.getLimit());
            ItemScanResponse response = storeClient.scan(request).block();
            return responseMapper.toListResponse(response);
        } catch (Exception e) {
            return responseMapper.toUnhandledResponse(TodoOperation.LIST, e);
        }
    }

    public ResponseEntity<?> create(String body) {
        try {
            ItemPutRequest request = requestMapper.toCreateRequest(body);
            log.debug("Creating a todo in table '{}'.", request.getTable());
            ItemPutResponse response = storeClient.putItem(request).block();
            return responseMapper.toCreateResponse(response);
        } catch (TodoValidationException e) {
            return responseMapper.toRejectedResponse(TodoOperation.CREATE, e);
        } catch (Exception e) {
            return responseMapper.toUnhandledResponse(TodoOperation.CREATE, e);
        }
    }

    public ResponseEntity<?> get(String todoId) {
        try {
            ItemGetRequest request = requestMapper.toGetRequest(todoId);
            log.debug("Getting todo {}.", todoId);
            ItemGetResponse response = storeClient.getItem(request).block();
            return responseMapper.toGetResponse(response);
        } catch (Exception e) {
            return responseMapper.toUnhandledResponse(TodoOperation.GET, e);
        }
    }

    public ResponseEntity<?> update(String todoId, String body) {
        try {
            ItemPutRequest request = requestMapper.toUpdateRequest(todoId, body);
            log.debug("Updating todo {}.", todoId);
            ItemPutResponse response = storeClient.putItem(request).block();
            return responseMapper.toUpdateResponse(response);
        } catch (TodoValidationException e) {
            return responseMapper.toRejectedResponse(TodoOperation.UPDATE, e);
        } catch (Exception e) {
            return responseMapper.toUnhandledResponse(TodoOperation.UPDATE, e);
        }
    }

    public ResponseEntity<?> delete(String todoId) {
        try {
            ItemDeleteRequest request = requestMapper.toDeleteRequest(todoId);
            log.debug("Deleting todo {}.", todoId);
            ItemDeleteResponse response = storeClient.deleteItem(request).block();
            return responseMapper.toDeleteResponse(response);
        } catch (Exception e) {
            return responseMapper.toUnhandledResponse(TodoOperation.DELETE, e);
        }
    }
}
