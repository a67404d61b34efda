package com.wifi.emitter.positioning.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.EmitterRow;
import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.dto.TrustedFix;
import com.wifi.emitter.positioning.emitter.EmitterRecord;
import com.wifi.emitter.positioning.emitter.EmitterStatus;
import com.wifi.emitter.positioning.exception.EmitterPersistenceException;
import com.wifi.emitter.positioning.repository.EmitterRepository;
import com.wifi.emitter.positioning.repository.impl.InMemoryEmitterRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("EmitterCache Tests")
class EmitterCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryEmitterRepository repository;
    private PositioningProperties properties;
    private EmitterCache cache;

    @BeforeEach
    void setUp() {
        repository = new InMemoryEmitterRepository();
        properties = new PositioningProperties();
        properties.getCache().setMaxAge(3);
        properties.getCache().setMaxWorkingSetSize(5);
        cache = new EmitterCache(repository, properties);
    }

    private static RfIdentification wifi(int n) {
        return RfIdentification.of(String.format("00:00:00:00:00:%02x", n), EmitterType.WLAN2);
    }

    private static EmitterRow row(RfIdentification id, double lat, double lon, double radius) {
        return EmitterRow.builder()
                .uniqueKey(id.uniqueKey())
                .type(id.type().name())
                .typeScopedId(id.typeScopedId())
                .latitude(lat)
                .longitude(lon)
                .radiusNs(radius)
                .radiusEw(radius)
                .label("")
                .build();
    }

    /** Observes the emitter and learns a first coverage point from an accurate fix. */
    private EmitterRecord learn(RfIdentification id, double lat, double lon) {
        EmitterRecord emitterRecord = cache.get(id);
        emitterRecord.setLastObservation(new Observation(id, 20, NOW));
        emitterRecord.updateLocation(new TrustedFix(lat, lon, 5.0, NOW));
        return emitterRecord;
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Should read all missing emitters with one query")
        void shouldBatchLoadWithOneQuery() {
            repository.addRow(row(wifi(1), 50.0, 8.0, 10.0));
            repository.addRow(row(wifi(2), 50.0, 8.0, 10.0));

            cache.batchLoad(List.of(wifi(1), wifi(2), wifi(3)));

            assertThat(repository.getLoadCalls()).isEqualTo(1);
            assertThat(cache.size()).isEqualTo(3);
            assertThat(cache.peek(wifi(1)).orElseThrow().getStatus()).isEqualTo(EmitterStatus.CACHED);
            assertThat(cache.peek(wifi(3)).orElseThrow().getStatus()).isEqualTo(EmitterStatus.UNKNOWN);
        }

        @Test
        @DisplayName("Should not query for resident emitters")
        void shouldSkipResidentEmitters() {
            cache.batchLoad(List.of(wifi(1), wifi(2)));

            cache.batchLoad(List.of(wifi(2), wifi(1)));

            assertThat(repository.getLoadCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("get creates an unknown record without reading the store")
        void getDoesNotReadStore() {
            repository.addRow(row(wifi(1), 50.0, 8.0, 10.0));

            EmitterRecord emitterRecord = cache.get(wifi(1));

            assertThat(repository.getLoadCalls()).isZero();
            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.UNKNOWN);
            assertThat(cache.get(wifi(1))).isSameAs(emitterRecord);
        }

        @Test
        @DisplayName("get returns null for a null id")
        void getNullId() {
            assertThat(cache.get(null)).isNull();
            assertThat(cache.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Sync")
    class SyncTests {

        @Test
        @DisplayName("Should insert new emitters and mark them cached")
        void shouldInsertNewEmitters() {
            EmitterRecord emitterRecord = learn(wifi(1), 50.0, 8.0);
            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.NEW);

            cache.sync();

            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.CACHED);
            assertThat(repository.row(wifi(1).uniqueKey())).isPresent();
            assertThat(repository.row(wifi(1).uniqueKey()).get().getLatitude()).isEqualTo(50.0);
            assertThat(repository.getCommittedTransactions()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not open a transaction when nothing is dirty")
        void shouldSkipCleanSync() {
            cache.get(wifi(1));

            cache.sync();

            assertThat(repository.getCommittedTransactions()).isZero();
        }

        @Test
        @DisplayName("Should write the invalid-radius marker for an oversized emitter")
        void shouldInvalidateOversizedEmitter() {
            repository.addRow(row(wifi(1), 50.0, 8.0, 0.0));
            cache.batchLoad(List.of(wifi(1)));
            EmitterRecord emitterRecord = cache.get(wifi(1));
            emitterRecord.setLastObservation(new Observation(wifi(1), 20, NOW));
            emitterRecord.updateLocation(new TrustedFix(51.0, 8.0, 100.0, NOW));

            cache.sync();

            EmitterRow stored = repository.row(wifi(1).uniqueKey()).orElseThrow();
            assertThat(stored.isInvalidated()).isTrue();
            assertThat(emitterRecord.getCoverage()).isEmpty();
            assertThat(emitterRecord.syncNeeded()).isFalse();
        }

        @Test
        @DisplayName("Should delete the row of a mobile hotspot")
        void shouldDropMobileHotspot() {
            repository.addRow(row(wifi(1), 50.0, 8.0, 10.0));
            cache.batchLoad(List.of(wifi(1)));
            cache.get(wifi(1)).setLastObservation(new Observation(wifi(1), 20, NOW, "AndroidAP", false));

            cache.sync();

            assertThat(repository.row(wifi(1).uniqueKey())).isEmpty();
        }

        @Test
        @DisplayName("Should evict records unused for maxAge syncs")
        void shouldEvictAgedRecords() {
            learn(wifi(1), 50.0, 8.0);
            cache.get(wifi(2));

            cache.sync();
            cache.sync();
            cache.get(wifi(2));
            cache.sync();

            assertThat(cache.peek(wifi(1))).isEmpty();
            assertThat(cache.peek(wifi(2))).isPresent();
        }

        @Test
        @DisplayName("Should clear the working set when it exceeds the cap")
        void shouldClearWhenOverCap() {
            for (int i = 0; i < 6; i++) {
                learn(wifi(i), 50.0, 8.0);
            }

            cache.sync();

            assertThat(cache.size()).isZero();
            assertThat(repository.size()).isEqualTo(6);
        }

        @Test
        @DisplayName("Should flush and close the store on close")
        void shouldFlushOnClose() {
            learn(wifi(1), 50.0, 8.0);

            cache.close();

            assertThat(repository.row(wifi(1).uniqueKey())).isPresent();
            assertThat(repository.isClosed()).isTrue();
            assertThat(cache.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Failed flush")
    class FailedFlushTests {

        private EmitterRepository failingRepository;

        @BeforeEach
        void setUp() {
            failingRepository = mock(EmitterRepository.class);
            cache = new EmitterCache(failingRepository, properties);
        }

        @Test
        @DisplayName("Should cancel the transaction and keep records dirty")
        void shouldKeepRecordsDirtyOnFailure() {
            doThrow(new EmitterPersistenceException("boom"))
                    .doNothing()
                    .when(failingRepository).endTransaction();
            EmitterRecord emitterRecord = learn(wifi(1), 50.0, 8.0);

            cache.sync();

            InOrder order = inOrder(failingRepository);
            order.verify(failingRepository).beginTransaction();
            order.verify(failingRepository).insert(any(EmitterRow.class));
            order.verify(failingRepository).endTransaction();
            order.verify(failingRepository).cancelTransaction();
            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.NEW);

            cache.sync();

            verify(failingRepository, times(2)).insert(any(EmitterRow.class));
            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.CACHED);
        }

        @Test
        @DisplayName("Should not evict aged dirty records when the flush fails")
        void shouldNotEvictDirtyRecordsOnFailure() {
            doThrow(new EmitterPersistenceException("boom")).when(failingRepository).endTransaction();
            learn(wifi(1), 50.0, 8.0);
            cache.get(wifi(2));

            cache.sync();
            cache.sync();
            cache.sync();

            assertThat(cache.peek(wifi(1))).isPresent();
            assertThat(cache.peek(wifi(2))).isEmpty();
            verify(failingRepository, times(3)).cancelTransaction();
            verify(failingRepository, never()).close();
        }

        @Test
        @DisplayName("Should cancel the transaction on an unexpected repository error")
        void shouldCancelOnUnexpectedError() {
            doThrow(new IllegalStateException("unexpected"))
                    .when(failingRepository).insert(any(EmitterRow.class));
            EmitterRecord emitterRecord = learn(wifi(1), 50.0, 8.0);

            assertThatCode(() -> cache.sync()).doesNotThrowAnyException();

            verify(failingRepository).cancelTransaction();
            verify(failingRepository, never()).endTransaction();
            assertThat(emitterRecord.getStatus()).isEqualTo(EmitterStatus.NEW);
        }
    }

    @Nested
    @DisplayName("Closed")
    class ClosedTests {

        @Test
        @DisplayName("Should not touch the store after close")
        void shouldIgnoreCallsAfterClose() {
            repository.addRow(row(wifi(1), 50.0, 8.0, 10.0));
            cache.close();

            cache.batchLoad(List.of(wifi(1)));
            cache.sync();

            assertThat(cache.isClosed()).isTrue();
            assertThat(repository.getLoadCalls()).isZero();
            assertThat(repository.getCommittedTransactions()).isZero();
            assertThat(cache.get(wifi(1))).isNull();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("Should close the store only once")
        void shouldCloseOnce() {
            EmitterRepository mockRepository = mock(EmitterRepository.class);
            cache = new EmitterCache(mockRepository, properties);

            cache.close();
            cache.close();

            verify(mockRepository, times(1)).close();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        private static final int DIRTY_RECORDS = 50;
        private static final int READERS = 4;
        private static final int SYNCERS = 2;
        private static final int ROUNDS = 200;

        @Test
        @DisplayName("Should serialize get, batchLoad and sync across threads")
        void shouldSerializeConcurrentAccess() throws Exception {
            properties.getCache().setMaxAge(10_000);
            properties.getCache().setMaxWorkingSetSize(10_000);
            cache = new EmitterCache(repository, properties);
            for (int i = 0; i < DIRTY_RECORDS; i++) {
                learn(wifi(i), 50.0, 8.0);
            }

            ExecutorService executor = Executors.newFixedThreadPool(READERS + SYNCERS);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < READERS; t++) {
                    int offset = 1_000 + t * ROUNDS;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < ROUNDS; i++) {
                            RfIdentification id = RfIdentification.of("reader-" + (offset + i), EmitterType.LTE);
                            cache.batchLoad(List.of(id));
                            assertThat(cache.get(id)).isNotNull();
                            cache.get(wifi(i % DIRTY_RECORDS));
                        }
                        return null;
                    }));
                }
                for (int t = 0; t < SYNCERS; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < ROUNDS / 10; i++) {
                            cache.sync();
                        }
                        return null;
                    }));
                }

                start.countDown();
                for (Future<?> future : futures) {
                    // a ConcurrentModificationException would surface here wrapped in an ExecutionException
                    assertThatCode(() -> future.get(30, TimeUnit.SECONDS)).doesNotThrowAnyException();
                }
            } finally {
                executor.shutdownNow();
            }

            cache.sync();

            assertThat(cache.size()).isEqualTo(DIRTY_RECORDS + READERS * ROUNDS);
            assertThat(repository.getWriteCalls()).isEqualTo(DIRTY_RECORDS);
            assertThat(repository.size()).isEqualTo(DIRTY_RECORDS);
            for (int i = 0; i < DIRTY_RECORDS; i++) {
                assertThat(cache.peek(wifi(i)).orElseThrow().getStatus()).isEqualTo(EmitterStatus.CACHED);
            }
        }
    }
}
