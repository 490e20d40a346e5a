package com.bteshome.todo.storeclient;

import com.bteshome.todo.storeclient.requests.ItemDeleteRequest;
import com.bteshome.todo.storeclient.requests.ItemGetRequest;
import com.bteshome.todo.storeclient.requests.ItemPutRequest;
import com.bteshome.todo.storeclient.requests.ItemScanRequest;
import com.bteshome.todo.storeclient.responses.ItemDeleteResponse;
import com.bteshome.todo.storeclient.responses.ItemGetResponse;
import com.bteshome.todo.storeclient.responses.ItemPutResponse;
import com.bteshome.todo.storeclient.responses.ItemScanResponse;
import reactor.core.publisher.Mono;

/**
 * Key-value store primitives.
 * <p>
 * Store-side failures (failed conditions, unknown tables, throttling) come back as a response
 * carrying the store's HTTP status code and error code. Only failures that never produced a
 * status code, such as a broken connection, are signalled as errors on the returned {@link Mono}.
 * <p>
 * Conditional puts and deletes evaluate their {@link com.bteshome.todo.storeclient.requests.ConditionExpression}
 * atomically with the mutation.
 */
public interface StoreClient {
    Mono<ItemScanResponse> scan(ItemScanRequest request);

    Mono<ItemPutResponse> putItem(ItemPutRequest request);

    Mono<ItemGetResponse> getItem(ItemGetRequest request);

    Mono<ItemDeleteResponse> deleteItem(ItemDeleteRequest request);
}
