package com.wifi.emitter.positioning.repository;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterRow;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.exception.EmitterPersistenceException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchGetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchGetResultPage;
import software.amazon.awssdk.enhanced.dynamodb.model.DescribeTableEnhancedResponse;
import software.amazon.awssdk.enhanced.dynamodb.model.ReadBatch;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * DynamoDB implementation of the EmitterRepository interface.
 *
 * <p>Methods are organized in layers: the public API, the batch read orchestration, the
 * transaction buffer and the health check. Reads use BatchGetItem in chunks of
 * {@value #MAX_BATCH_SIZE}; buffered writes are committed with TransactWriteItems in chunks of
 * {@value #MAX_TRANSACTION_SIZE}. DynamoDB offers no atomicity across chunks, so a failure in a
 * later chunk leaves earlier chunks committed. Every write is an idempotent put or delete of the
 * record's complete row, so replaying the whole flush on the next sync converges.
 */
@Repository
@Profile("!test")
public class DynamoDbEmitterRepository implements EmitterRepository {

    // === BATCH OPERATION CONSTANTS ===

    /** DynamoDB service limit for keys in one BatchGetItem request. */
    private static final int MAX_BATCH_SIZE = 100;

    /** DynamoDB service limit for actions in one TransactWriteItems request. */
    private static final int MAX_TRANSACTION_SIZE = 100;

    /** Retries for keys DynamoDB returns unprocessed because of throttling. */
    private static final int MAX_BATCH_RETRIES = 3;

    // === HEALTH CHECK CONSTANTS ===

    private static final long LATENCY_THRESHOLD_MS = 1_000L;
    private static final long NANOS_TO_MILLIS = 1_000_000L;
    private static final String HEALTHY_STATUS_MESSAGE = "Table is accessible and healthy";
    private static final String SLOW_RESPONSE_STATUS_MESSAGE =
            "Table response time exceeds threshold";

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbEmitterRepository.class);

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<EmitterRow> emitterTable;
    private final String tableName;

    /** Buffered writes by unique key; a later write to the same emitter replaces the earlier one. */
    private final Map<String, PendingWrite> pendingWrites = new LinkedHashMap<>();
    private boolean inTransaction;

    public DynamoDbEmitterRepository(
            DynamoDbEnhancedClient enhancedClient, PositioningProperties properties) {
        this.enhancedClient = enhancedClient;
        this.tableName = properties.getPersistence().getEmitterTable();
        this.emitterTable = enhancedClient.table(tableName, TableSchema.fromBean(EmitterRow.class));
        logger.info("Initialized DynamoDbEmitterRepository with table: {}", tableName);
    }

    // === PUBLIC API LAYER ===

    @Override
    public synchronized Map<String, EmitterRow> load(Collection<RfIdentification> identifications) {
        Map<String, EmitterRow> results = new HashMap<>();
        if (identifications == null || identifications.isEmpty()) {
            return results;
        }
        try {
            for (List<String> batch : partitionIntoBatches(uniqueKeys(identifications))) {
                results.putAll(processSingleBatch(batch));
            }
        } catch (SdkException e) {
            logger.error("Error in batch retrieval of {} emitters", identifications.size(), e);
            throw new EmitterPersistenceException("Failed to load emitters in batch", e);
        }
        logger.debug("Loaded {} of {} requested emitters", results.size(), identifications.size());
        return results;
    }

    @Override
    public synchronized Optional<EmitterRow> loadOne(RfIdentification identification) {
        try {
            return Optional.ofNullable(emitterTable.getItem(buildKey(identification.uniqueKey())));
        } catch (SdkException e) {
            logger.error("Error retrieving emitter: {}", identification, e);
            throw new EmitterPersistenceException("Failed to load emitter " + identification, e);
        }
    }

    @Override
    public synchronized void insert(EmitterRow row) {
        write(PendingWrite.put(row));
    }

    @Override
    public synchronized void update(EmitterRow row) {
        write(PendingWrite.put(row));
    }

    @Override
    public synchronized void invalidate(EmitterRow row) {
        EmitterRow marker = row.toBuilder()
                .radiusNs(EmitterRow.INVALID_RADIUS)
                .radiusEw(EmitterRow.INVALID_RADIUS)
                .build();
        write(PendingWrite.put(marker));
    }

    @Override
    public synchronized void drop(EmitterRow row) {
        write(PendingWrite.delete(row.getUniqueKey()));
    }

    @Override
    public synchronized void beginTransaction() {
        if (inTransaction) {
            logger.warn("beginTransaction() called while a transaction is already open - ignored");
            return;
        }
        inTransaction = true;
        pendingWrites.clear();
    }

    @Override
    public synchronized void endTransaction() {
        if (!inTransaction) {
            return;
        }
        try {
            commit(new ArrayList<>(pendingWrites.values()));
        } finally {
            pendingWrites.clear();
            inTransaction = false;
        }
    }

    @Override
    public synchronized void cancelTransaction() {
        if (!inTransaction) {
            return;
        }
        logger.debug("Discarding {} buffered emitter writes", pendingWrites.size());
        pendingWrites.clear();
        inTransaction = false;
    }

    @Override
    public synchronized void close() {
        if (!pendingWrites.isEmpty()) {
            logger.warn("Closing emitter store with {} uncommitted writes", pendingWrites.size());
        }
        pendingWrites.clear();
        inTransaction = false;
        logger.info("Closed emitter store for table: {}", tableName);
    }

    // === ORCHESTRATION LAYER ===

    /**
     * Reads one batch, re-requesting keys that DynamoDB returned unprocessed.
     *
     * @param keyBatch at most {@value #MAX_BATCH_SIZE} unique keys
     * @return rows found, keyed by unique key
     */
    private Map<String, EmitterRow> processSingleBatch(List<String> keyBatch) {
        Map<String, EmitterRow> batchResults = new HashMap<>();
        List<Key> remaining = keyBatch.stream().map(this::buildKey).toList();

        int retryCount = 0;
        while (!remaining.isEmpty()) {
            BatchOperationResult operationResult = executeBatchOperation(buildBatchRequest(remaining));
            batchResults.putAll(operationResult.results());
            remaining = operationResult.unprocessedKeys();
            if (remaining.isEmpty()) {
                break;
            }
            retryCount++;
            if (retryCount > MAX_BATCH_RETRIES) {
                throw new EmitterPersistenceException(
                        "Failed to process " + remaining.size() + " keys after " + MAX_BATCH_RETRIES + " retries");
            }
            logger.warn("Batch read has {} unprocessed keys after attempt {}", remaining.size(), retryCount);
        }
        return batchResults;
    }

    private void write(PendingWrite pendingWrite) {
        if (inTransaction) {
            pendingWrites.put(pendingWrite.uniqueKey(), pendingWrite);
        } else {
            commit(List.of(pendingWrite));
        }
    }

    /**
     * Commits writes in TransactWriteItems chunks.
     *
     * @throws EmitterPersistenceException if any chunk is rejected
     */
    private void commit(List<PendingWrite> writes) {
        if (writes.isEmpty()) {
            return;
        }
        int committed = 0;
        try {
            for (List<PendingWrite> chunk : batchItems(writes, MAX_TRANSACTION_SIZE)) {
                enhancedClient.transactWriteItems(buildTransactionRequest(chunk));
                committed += chunk.size();
            }
        } catch (SdkException e) {
            logger.error("Emitter transaction failed after {} of {} writes", committed, writes.size(), e);
            throw new EmitterPersistenceException("Failed to commit emitter writes", e);
        }
        logger.debug("Committed {} emitter writes", committed);
    }

    // === IMPLEMENTATION LAYER ===

    private Key buildKey(String uniqueKey) {
        return Key.builder().partitionValue(uniqueKey).build();
    }

    private BatchGetItemEnhancedRequest buildBatchRequest(List<Key> keys) {
        ReadBatch.Builder<EmitterRow> readBatchBuilder =
                ReadBatch.builder(EmitterRow.class).mappedTableResource(emitterTable);
        keys.forEach(readBatchBuilder::addGetItem);
        return BatchGetItemEnhancedRequest.builder()
                .readBatches(readBatchBuilder.build())
                .build();
    }

    private BatchOperationResult executeBatchOperation(BatchGetItemEnhancedRequest batchRequest) {
        Map<String, EmitterRow> results = new HashMap<>();
        List<Key> unprocessedKeys = new ArrayList<>();
        for (BatchGetResultPage page : enhancedClient.batchGetItem(batchRequest)) {
            for (EmitterRow row : page.resultsForTable(emitterTable)) {
                results.put(row.getUniqueKey(), row);
            }
            unprocessedKeys.addAll(page.unprocessedKeysForTable(emitterTable));
        }
        return new BatchOperationResult(results, unprocessedKeys);
    }

    private TransactWriteItemsEnhancedRequest buildTransactionRequest(List<PendingWrite> chunk) {
        TransactWriteItemsEnhancedRequest.Builder builder = TransactWriteItemsEnhancedRequest.builder();
        for (PendingWrite pendingWrite : chunk) {
            if (pendingWrite.row() != null) {
                builder.addPutItem(emitterTable, pendingWrite.row());
            } else {
                builder.addDeleteItem(emitterTable, buildKey(pendingWrite.uniqueKey()));
            }
        }
        return builder.build();
    }

    // === UTILITY LAYER ===

    private List<String> uniqueKeys(Collection<RfIdentification> identifications) {
        return identifications.stream().map(RfIdentification::uniqueKey).distinct().toList();
    }

    private List<List<String>> partitionIntoBatches(List<String> uniqueKeys) {
        return batchItems(uniqueKeys, MAX_BATCH_SIZE);
    }

    private <T> List<List<T>> batchItems(List<T> items, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            int endIndex = Math.min(i + batchSize, items.size());
            batches.add(items.subList(i, endIndex));
        }
        return batches;
    }

    /**
     * @param results rows keyed by unique key
     * @param unprocessedKeys keys to request again
     */
    private record BatchOperationResult(Map<String, EmitterRow> results, List<Key> unprocessedKeys) {
    }

    /** A buffered put (row present) or delete (row null). */
    private record PendingWrite(String uniqueKey, EmitterRow row) {
        static PendingWrite put(EmitterRow row) {
            return new PendingWrite(row.getUniqueKey(), row);
        }

        static PendingWrite delete(String uniqueKey) {
            return new PendingWrite(uniqueKey, null);
        }
    }

    // === HEALTH CHECK METHODS ===

    @Override
    public HealthCheckResult validateTableHealth()
            throws ResourceNotFoundException, DynamoDbException, Exception {
        logger.debug("Starting table health validation for: {}", tableName);
        long startTime = System.nanoTime();
        try {
            DescribeTableEnhancedResponse response = emitterTable.describeTable();
            long itemCount = response.table().itemCount();

            long responseTimeMs = calculateResponseTime(startTime);
            boolean isHealthy = responseTimeMs < LATENCY_THRESHOLD_MS;
            String statusMessage = isHealthy ? HEALTHY_STATUS_MESSAGE : SLOW_RESPONSE_STATUS_MESSAGE;

            logger.debug(
                    "Table health check completed - Table: {}, Response time: {}ms, Healthy: {}, Item count: {}",
                    tableName,
                    responseTimeMs,
                    isHealthy,
                    itemCount);
            return new HealthCheckResult(isHealthy, responseTimeMs, tableName, itemCount, statusMessage);
        } catch (ResourceNotFoundException e) {
            handleHealthCheckException(e, startTime, "Table not found during health check");
            throw e;
        } catch (DynamoDbException e) {
            handleHealthCheckException(e, startTime, "DynamoDB error during health check");
            throw e;
        }
    }

    private long calculateResponseTime(long startTime) {
        return (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
    }

    private void handleHealthCheckException(Exception exception, long startTime, String message) {
        long responseTimeMs = calculateResponseTime(startTime);
        logger.error("{}: {} (response time: {}ms)", message, tableName, responseTimeMs, exception);
    }
}
