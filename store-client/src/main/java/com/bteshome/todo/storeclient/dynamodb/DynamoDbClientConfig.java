package com.bteshome.todo.storeclient.dynamodb;

import com.bteshome.todo.storeclient.StoreClientException;
import com.bteshome.todo.storeclient.StoreSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClientBuilder;

import java.net.URI;

@Configuration
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = "dynamodb")
@Slf4j
public class DynamoDbClientConfig {
    @Bean
    public DynamoDbAsyncClient dynamoDbAsyncClient(StoreSettings storeSettings) {
        if (storeSettings.getRegion() == null || storeSettings.getRegion().isBlank())
            throw new StoreClientException("store.region is required when store.type is dynamodb.");

        DynamoDbAsyncClientBuilder builder = DynamoDbAsyncClient.builder()
                .region(Region.of(storeSettings.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());

        if (storeSettings.getEndpointOverride() != null && !storeSettings.getEndpointOverride().isBlank()) {
            log.info("Using DynamoDB endpoint override {}.", storeSettings.getEndpointOverride());
            builder.endpointOverride(URI.create(storeSettings.getEndpointOverride()));
        }

        return builder.build();
    }
}
