package com.wifi.emitter.positioning.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.wifi.emitter.positioning.config.PositioningProperties;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

class DynamoDBConfigTest {

    @Test
    void awsDynamoDbClient_UsesPersistenceSettings() {
        // Given
        PositioningProperties properties = new PositioningProperties();
        properties.getPersistence().setRegion("eu-west-1");
        properties.getPersistence().setApiCallTimeout(Duration.ofSeconds(3));

        // When
        try (DynamoDbClient client = new DynamoDBConfig(properties).awsDynamoDbClient()) {
            // Then
            assertThat(client.serviceClientConfiguration().region()).isEqualTo(Region.EU_WEST_1);
            assertThat(client.serviceClientConfiguration().endpointOverride()).isEmpty();
            assertThat(client.serviceClientConfiguration().overrideConfiguration().apiCallTimeout())
                    .contains(Duration.ofSeconds(3));
        }
    }

    @Test
    void localDynamoDbClient_BlankEndpoint_IsNotOverridden() {
        PositioningProperties properties = new PositioningProperties();
        properties.getPersistence().setEndpoint("  ");

        try (DynamoDbClient client = new DynamoDBConfig(properties).localDynamoDbClient()) {
            assertThat(client.serviceClientConfiguration().endpointOverride()).isEmpty();
        }
    }

    @Test
    void localDynamoDbClient_EndpointConfigured_OverridesEndpoint() {
        PositioningProperties properties = new PositioningProperties();
        properties.getPersistence().setEndpoint("http://localhost:8000");

        try (DynamoDbClient client = new DynamoDBConfig(properties).localDynamoDbClient()) {
            assertThat(client.serviceClientConfiguration().endpointOverride())
                    .contains(URI.create("http://localhost:8000"));
            assertThat(client.serviceClientConfiguration().region()).isEqualTo(Region.US_EAST_1);
        }
    }
}
