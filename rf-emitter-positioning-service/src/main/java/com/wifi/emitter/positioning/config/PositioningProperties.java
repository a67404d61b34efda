package com.wifi.emitter.positioning.config;

import com.wifi.emitter.positioning.algorithm.SynthesisMode;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the positioning service.
 * Maps to the 'positioning' section in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "positioning")
public class PositioningProperties {

    private Cache cache = new Cache();
    private Synthesis synthesis = new Synthesis();
    private Processing processing = new Processing();
    private Persistence persistence = new Persistence();

    @Data
    public static class Cache {
        /** Sync cycles a record may go unused before it becomes eligible for eviction. */
        private int maxAge = 30;
        /** Hard cap on resident records; above it the working set is cleared after a sync. */
        private int maxWorkingSetSize = 500;
    }

    @Data
    public static class Synthesis {
        private SynthesisMode mode = SynthesisMode.CULL;
        private double cullTolerance = 1.25;
        private double minimumBelievableAccuracy = 15.0;
        private double accuracySignalScaling = 0.7;
        private double medianTrimFactor = 2.0;
        private double maxTrimmedFraction = 0.2;
        private double disagreementFactor = 2.0;
        private double accuracyInflation = 1.5;
    }

    @Data
    public static class Processing {
        private int queueCapacity = 100;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Persistence {
        private String emitterTable = "rf_emitters";
        private String signalCorrectionTable = "rf_signal_corrections";
        private String region = "us-east-1";
        /** Overrides the regional endpoint, for DynamoDB Local. */
        private String endpoint;
        private Duration apiCallTimeout = Duration.ofSeconds(10);
    }
}
