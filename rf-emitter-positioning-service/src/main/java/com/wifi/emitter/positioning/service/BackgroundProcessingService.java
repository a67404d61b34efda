package com.wifi.emitter.positioning.service;

import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.TrustedFix;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Hands positioning work to the single "emitterProcessingExecutor" thread, so scan callbacks and
 * fix listeners on other threads never touch emitter records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackgroundProcessingService {

    private final EmitterLocationService emitterLocationService;

    /**
     * Queues a batch of observations.
     *
     * @param observations observations of one scan
     * @param fix trusted fix taken at scan time, or null
     * @return future completing when the batch has been applied
     * @throws com.wifi.emitter.positioning.config.AsyncConfig.ProcessingQueueFullException if the
     *     queue is full
     */
    @Async("emitterProcessingExecutor")
    public CompletableFuture<Void> submitObservations(Collection<Observation> observations, TrustedFix fix) {
        // copied so the producer may reuse its collection
        List<Observation> batch = new ArrayList<>(observations);
        try {
            emitterLocationService.processObservations(batch, fix);
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Processing of {} observations failed", batch.size(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Queues the end of the current reporting interval behind all observations already queued.
     *
     * @return future with the fused location, empty if none
     */
    @Async("emitterProcessingExecutor")
    public CompletableFuture<Optional<FusedLocation>> completePeriod() {
        try {
            return CompletableFuture.completedFuture(emitterLocationService.completePeriod());
        } catch (RuntimeException e) {
            log.error("End of period processing failed", e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
