package com.wifi.emitter.positioning.health;

import com.wifi.emitter.positioning.cache.EmitterCache;
import com.wifi.emitter.positioning.repository.EmitterRepository;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Health indicator for the emitter store.
 *
 * <p>Delegates the table check to {@link EmitterRepository#validateTableHealth()} and adds the
 * number of records resident in the cache. Reports UP when the repository is healthy, DOWN when it
 * is slow, the table is missing or DynamoDB is unreachable, and OUT_OF_SERVICE for anything else.
 */
@Component("emitterStore")
public class EmitterStoreHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(EmitterStoreHealthIndicator.class);

    private static final String DATABASE_TYPE = "DynamoDB";

    private static final String STORE_ACCESSIBLE_MESSAGE = "Emitter store is accessible";
    private static final String STORE_NOT_ACCESSIBLE_MESSAGE = "Emitter store is not accessible";
    private static final String TABLE_NOT_FOUND_MESSAGE = "Emitter table not found";
    private static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error during health check";

    private static final String STATUS_KEY = "status";
    private static final String DATABASE_KEY = "database";
    private static final String TABLE_NAME_KEY = "tableName";
    private static final String LAST_CHECKED_KEY = "lastChecked";
    private static final String RESPONSE_TIME_KEY = "responseTimeMs";
    private static final String ITEM_COUNT_KEY = "itemCount";
    private static final String CACHED_EMITTERS_KEY = "cachedEmitters";
    private static final String ERROR_KEY = "error";

    private static final long NANOS_TO_MILLIS = 1_000_000L;

    private final EmitterRepository repository;
    private final EmitterCache cache;

    public EmitterStoreHealthIndicator(EmitterRepository repository, EmitterCache cache) {
        this.repository = repository;
        this.cache = cache;
    }

    @Override
    public Health health() {
        Instant lastChecked = Instant.now();
        long startTime = System.nanoTime();

        try {
            EmitterRepository.HealthCheckResult result = repository.validateTableHealth();

            Health.Builder builder = result.isHealthy() ? Health.up() : Health.down();
            if (result.isHealthy()) {
                logger.debug("Emitter store health check successful - Table: {}, Response time: {}ms",
                        result.tableName(), result.responseTimeMs());
            } else {
                logger.warn("Emitter store health check indicates poor performance - Table: {}, Response time: {}ms, Status: {}",
                        result.tableName(), result.responseTimeMs(), result.statusMessage());
            }
            return builder
                    .withDetail(STATUS_KEY, result.isHealthy() ? STORE_ACCESSIBLE_MESSAGE : result.statusMessage())
                    .withDetail(DATABASE_KEY, DATABASE_TYPE)
                    .withDetail(TABLE_NAME_KEY, result.tableName())
                    .withDetail(LAST_CHECKED_KEY, lastChecked)
                    .withDetail(RESPONSE_TIME_KEY, result.responseTimeMs())
                    .withDetail(ITEM_COUNT_KEY, result.itemCount())
                    .withDetail(CACHED_EMITTERS_KEY, cache.size())
                    .build();

        } catch (ResourceNotFoundException e) {
            long responseTimeMs = (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
            logger.warn("Emitter table not found during health check (response time: {}ms)", responseTimeMs);
            return failure(Health.down(), TABLE_NOT_FOUND_MESSAGE, lastChecked, responseTimeMs, e);

        } catch (DynamoDbException e) {
            long responseTimeMs = (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
            logger.error("DynamoDB error during emitter store health check (response time: {}ms)", responseTimeMs, e);
            return failure(Health.down(), STORE_NOT_ACCESSIBLE_MESSAGE, lastChecked, responseTimeMs, e);

        } catch (Exception e) {
            long responseTimeMs = (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
            logger.error("Unexpected error during emitter store health check (response time: {}ms)", responseTimeMs, e);
            return failure(Health.outOfService(), UNEXPECTED_ERROR_MESSAGE, lastChecked, responseTimeMs, e);
        }
    }

    private Health failure(Health.Builder builder, String status, Instant lastChecked, long responseTimeMs, Exception e) {
        return builder
                .withDetail(STATUS_KEY, status)
                .withDetail(DATABASE_KEY, DATABASE_TYPE)
                .withDetail(LAST_CHECKED_KEY, lastChecked)
                .withDetail(RESPONSE_TIME_KEY, responseTimeMs)
                .withDetail(CACHED_EMITTERS_KEY, cache.size())
                .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
                .build();
    }
}
