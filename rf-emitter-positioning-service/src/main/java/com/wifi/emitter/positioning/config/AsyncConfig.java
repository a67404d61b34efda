package com.wifi.emitter.positioning.config;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the background processing thread.
 * Emitter records are not synchronized, so exactly one worker thread applies observations and
 * runs position synthesis; the bounded queue gives producers backpressure.
 */
@Configuration
@EnableAsync
@RequiredArgsConstructor
@Slf4j
public class AsyncConfig {

    private final PositioningProperties positioningProperties;

    // kept for graceful shutdown
    private ThreadPoolTaskExecutor processingExecutor;

    @Bean(name = "emitterProcessingExecutor")
    public ThreadPoolTaskExecutor emitterProcessingExecutor() {
        PositioningProperties.Processing processing = positioningProperties.getProcessing();

        processingExecutor = new ThreadPoolTaskExecutor();

        // a single worker keeps record mutation on one thread
        processingExecutor.setCorePoolSize(1);
        processingExecutor.setMaxPoolSize(1);

        processingExecutor.setQueueCapacity(processing.getQueueCapacity());
        processingExecutor.setThreadNamePrefix("emitter-processing-");
        processingExecutor.setRejectedExecutionHandler(new ProcessingRejectedExecutionHandler());

        processingExecutor.setWaitForTasksToCompleteOnShutdown(true);
        processingExecutor.setAwaitTerminationSeconds((int) processing.getShutdownTimeout().toSeconds());

        processingExecutor.initialize();

        log.info("Initialized emitter processing executor - queueCapacity: {}", processing.getQueueCapacity());
        return processingExecutor;
    }

    /**
     * Lets queued observations and period ends finish before the cache is closed.
     */
    @PreDestroy
    public void shutdown() {
        if (processingExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = processingExecutor.getThreadPoolExecutor();
        log.info("Shutting down emitter processing - Queue size: {}, Active threads: {}",
            executor.getQueue().size(), executor.getActiveCount());

        long timeoutSeconds = positioningProperties.getProcessing().getShutdownTimeout().toSeconds();
        try {
            processingExecutor.shutdown();
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Emitter processing did not complete within {} seconds, forcing shutdown", timeoutSeconds);
                executor.shutdownNow();
            } else {
                log.info("Emitter processing shutdown completed gracefully");
            }
        } catch (InterruptedException e) {
            log.warn("Shutdown interrupted, forcing immediate termination");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Logs and rejects work when the processing queue is full.
     */
    private static class ProcessingRejectedExecutionHandler implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Emitter processing queue is full - rejecting task. Queue size: {}", executor.getQueue().size());
            throw new ProcessingQueueFullException(
                "Emitter processing queue is full. Queue size: " + executor.getQueue().size());
        }
    }

    /**
     * Exception thrown when the processing queue is full.
     */
    public static class ProcessingQueueFullException extends RejectedExecutionException {
        public ProcessingQueueFullException(String message) {
            super(message);
        }
    }
}
