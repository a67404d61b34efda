package com.wifi.emitter.positioning.repository;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.SignalCorrection;
import com.wifi.emitter.positioning.exception.EmitterPersistenceException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Slf4j
@Repository
@Profile("!test")
public class DynamoDbSignalCorrectionRepository implements SignalCorrectionRepository {

    private final DynamoDbTable<SignalCorrection> correctionTable;

    public DynamoDbSignalCorrectionRepository(
            DynamoDbEnhancedClient enhancedClient, PositioningProperties properties) {
        String tableName = properties.getPersistence().getSignalCorrectionTable();
        this.correctionTable = enhancedClient.table(tableName, TableSchema.fromBean(SignalCorrection.class));
        log.info("Initialized DynamoDbSignalCorrectionRepository with table: {}", tableName);
    }

    @Override
    public Optional<SignalCorrection> findByType(EmitterType type) {
        try {
            Key key = Key.builder().partitionValue(type.name()).build();
            return Optional.ofNullable(correctionTable.getItem(key));
        } catch (SdkException e) {
            log.error("Error reading signal correction for {}", type, e);
            throw new EmitterPersistenceException("Failed to read signal correction for " + type, e);
        }
    }

    @Override
    public void save(SignalCorrection correction) {
        try {
            correctionTable.putItem(correction);
        } catch (SdkException e) {
            log.error("Error saving signal correction for {}", correction.getEmitterType(), e);
            throw new EmitterPersistenceException(
                    "Failed to save signal correction for " + correction.getEmitterType(), e);
        }
    }
}
