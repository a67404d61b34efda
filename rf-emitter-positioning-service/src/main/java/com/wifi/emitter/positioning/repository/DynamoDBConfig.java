package com.wifi.emitter.positioning.repository;

import com.wifi.emitter.positioning.config.PositioningProperties;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * DynamoDB clients for the emitter and signal correction tables, configured from
 * {@code positioning.persistence}.
 */
@Slf4j
@Configuration
@Profile("!test")
public class DynamoDBConfig {

    private final PositioningProperties.Persistence persistence;

    public DynamoDBConfig(PositioningProperties properties) {
        this.persistence = properties.getPersistence();
    }

    @Bean
    @Profile("local")
    public DynamoDbClient localDynamoDbClient() {
        // DynamoDB Local accepts any credentials
        return clientBuilder()
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create("dummy", "dummy")))
                .build();
    }

    @Bean
    @Profile("!local")
    public DynamoDbClient awsDynamoDbClient() {
        // default credential provider chain
        return clientBuilder().build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    DynamoDbClientBuilder clientBuilder() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(persistence.getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(persistence.getApiCallTimeout())
                        .build());
        String endpoint = persistence.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("DynamoDB client for tables {} and {} in {}{}",
                persistence.getEmitterTable(), persistence.getSignalCorrectionTable(), persistence.getRegion(),
                endpoint == null || endpoint.isBlank() ? "" : " at " + endpoint);
        return builder;
    }
}
