package com.wifi.emitter.positioning.repository;

import com.wifi.emitter.positioning.dto.EmitterRow;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.exception.EmitterPersistenceException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Row store for learned emitter coverage.
 *
 * <p>Writes issued between {@link #beginTransaction()} and {@link #endTransaction()} are buffered
 * and committed together; {@link #cancelTransaction()} discards them. Writes issued outside a
 * transaction are committed immediately. Failures surface as {@link EmitterPersistenceException}.
 */
public interface EmitterRepository {

    /**
     * Loads the rows for several emitters in as few round trips as the store allows.
     *
     * @param identifications emitters to look up
     * @return rows found, keyed by unique key; absent emitters have no entry
     */
    Map<String, EmitterRow> load(Collection<RfIdentification> identifications);

    /**
     * Loads a single row.
     *
     * @param identification emitter to look up
     * @return the row if the emitter is known
     */
    Optional<EmitterRow> loadOne(RfIdentification identification);

    void insert(EmitterRow row);

    void update(EmitterRow row);

    /** Keeps the row but replaces its radii with {@link EmitterRow#INVALID_RADIUS}. */
    void invalidate(EmitterRow row);

    void drop(EmitterRow row);

    /** Starts buffering writes. A nested call logs a warning and does nothing. */
    void beginTransaction();

    /** Commits buffered writes. Without an open transaction this does nothing. */
    void endTransaction();

    /** Discards buffered writes. Without an open transaction this does nothing. */
    void cancelTransaction();

    /** Releases store resources. Pending buffered writes are discarded. */
    void close();

    /**
     * Validates table accessibility and measures response time for health checks.
     *
     * @return HealthCheckResult containing validation results and metrics
     * @throws ResourceNotFoundException if the table does not exist
     * @throws DynamoDbException if there are connectivity or permission issues
     * @throws Exception for unexpected errors during validation
     */
    HealthCheckResult validateTableHealth() throws ResourceNotFoundException, DynamoDbException, Exception;

    /**
     * Result object for health check operations containing metrics and validation results.
     */
    record HealthCheckResult(
            boolean isHealthy,
            long responseTimeMs,
            String tableName,
            long itemCount,
            String statusMessage
    ) {}
}
