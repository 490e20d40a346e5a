package com.bteshome.todo.storeclient.dynamodb;

import com.bteshome.todo.storeclient.StoreClient;
import com.bteshome.todo.storeclient.StoreClientException;
import com.bteshome.todo.storeclient.requests.*;
import com.bteshome.todo.storeclient.responses.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link StoreClient} backed by DynamoDB. Every call is a single request with the SDK's own
 * retry policy left as configured on the client.
 */
@Component
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = "dynamodb")
@RequiredArgsConstructor
@Slf4j
public class DynamoDbStoreClient implements StoreClient {
    private final DynamoDbAsyncClient dynamoDbClient;

    @Override
    public Mono<ItemScanResponse> scan(ItemScanRequest request) {
        ScanRequest scanRequest = ScanRequest.builder()
                .tableName(request.getTable())
                .limit(request.getLimit())
                .build();

        return Mono.fromFuture(() -> dynamoDbClient.scan(scanRequest))
                .map(response -> ItemScanResponse.builder()
                        .httpStatusCode(HttpStatus.OK.value())
                        .items(response.items()
                                .stream()
                                .map(DynamoDbStoreClient::fromAttributeValues)
                                .toList())
                        .build())
                .onErrorResume(AwsServiceException.class, e -> Mono.just(ItemScanResponse.builder()
                        .httpStatusCode(e.statusCode())
                        .errorCode(errorCode(e))
                        .errorMessage(e.getMessage())
                        .build()))
                .doOnNext(response -> log.debug("Scan on table '{}' returned status {}.", request.getTable(), response.getHttpStatusCode()))
                .onErrorMap(SdkClientException.class, e -> clientFailure("Scan", request.getTable(), e));
    }

    @Override
    public Mono<ItemPutResponse> putItem(ItemPutRequest request) {
        PutItemRequest.Builder putItemRequest = PutItemRequest.builder()
                .tableName(request.getTable())
                .item(toAttributeValues(request.getItem()));

        if (request.getCondition() != null)
            putItemRequest.conditionExpression(request.getCondition().toExpression());

        return Mono.fromFuture(() -> dynamoDbClient.putItem(putItemRequest.build()))
                .map(response -> ItemPutResponse.builder()
                        .httpStatusCode(HttpStatus.OK.value())
                        .build())
                .onErrorResume(AwsServiceException.class, e -> Mono.just(ItemPutResponse.builder()
                        .httpStatusCode(e.statusCode())
                        .errorCode(errorCode(e))
                        .errorMessage(e.getMessage())
                        .build()))
                .onErrorMap(SdkClientException.class, e -> clientFailure("PutItem", request.getTable(), e));
    }

    @Override
    public Mono<ItemGetResponse> getItem(ItemGetRequest request) {
        GetItemRequest getItemRequest = GetItemRequest.builder()
                .tableName(request.getTable())
                .key(toAttributeValues(request.getKey()))
                .build();

        return Mono.fromFuture(() -> dynamoDbClient.getItem(getItemRequest))
                .map(response -> ItemGetResponse.builder()
                        .httpStatusCode(HttpStatus.OK.value())
                        .item(response.hasItem() && !response.item().isEmpty() ? fromAttributeValues(response.item()) : null)
                        .build())
                .onErrorResume(AwsServiceException.class, e -> Mono.just(ItemGetResponse.builder()
                        .httpStatusCode(e.statusCode())
                        .errorCode(errorCode(e))
                        .errorMessage(e.getMessage())
                        .build()))
                .onErrorMap(SdkClientException.class, e -> clientFailure("GetItem", request.getTable(), e));
    }

    @Override
    public Mono<ItemDeleteResponse> deleteItem(ItemDeleteRequest request) {
        DeleteItemRequest.Builder deleteItemRequest = DeleteItemRequest.builder()
                .tableName(request.getTable())
                .key(toAttributeValues(request.getKey()));

        if (request.getCondition() != null)
            deleteItemRequest.conditionExpression(request.getCondition().toExpression());

        return Mono.fromFuture(() -> dynamoDbClient.deleteItem(deleteItemRequest.build()))
                .map(response -> ItemDeleteResponse.builder()
                        .httpStatusCode(HttpStatus.OK.value())
                        .build())
                .onErrorResume(AwsServiceException.class, e -> Mono.just(ItemDeleteResponse.builder()
                        .httpStatusCode(e.statusCode())
                        .errorCode(errorCode(e))
                        .errorMessage(e.getMessage())
                        .build()))
                .onErrorMap(SdkClientException.class, e -> clientFailure("DeleteItem", request.getTable(), e));
    }

    private static Map<String, AttributeValue> toAttributeValues(Map<String, String> attributes) {
        Map<String, AttributeValue> attributeValues = new LinkedHashMap<>();
        if (attributes != null)
            attributes.forEach((name, value) -> attributeValues.put(name, AttributeValue.builder().s(value).build()));
        return attributeValues;
    }

    // only string attributes are carried over
    private static Map<String, String> fromAttributeValues(Map<String, AttributeValue> attributeValues) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributeValues.forEach((name, value) -> {
            if (value.s() != null)
                attributes.put(name, value.s());
        });
        return Collections.unmodifiableMap(attributes);
    }

    private static String errorCode(AwsServiceException e) {
        if (e instanceof ConditionalCheckFailedException)
            return ErrorCode.CONDITIONAL_CHECK_FAILED;
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null)
            return e.awsErrorDetails().errorCode();
        return e.getClass().getSimpleName();
    }

    private static StoreClientException clientFailure(String operation, String table, SdkClientException e) {
        return new StoreClientException("DynamoDB %s on table '%s' failed before a response was received.".formatted(operation, table), e);
    }
}
