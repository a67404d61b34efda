package com.wifi.emitter.positioning.algorithm.impl;

import com.wifi.emitter.positioning.algorithm.LocationSynthesizer;
import com.wifi.emitter.positioning.algorithm.SynthesisMode;
import com.wifi.emitter.positioning.config.PositioningProperties;
import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.RfLocation;
import java.util.Collection;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatches to the fusion strategy selected by {@code positioning.synthesis.mode}.
 */
@Slf4j
@Component
public class DefaultLocationSynthesizer implements LocationSynthesizer {

    private final EmitterClusterCuller culler;
    private final WeightedAverageLocationCalculator weightedAverage;
    private final MedianCullLocationCalculator medianCull;
    private final SynthesisMode mode;

    public DefaultLocationSynthesizer(
            EmitterClusterCuller culler,
            WeightedAverageLocationCalculator weightedAverage,
            MedianCullLocationCalculator medianCull,
            PositioningProperties properties) {
        this.culler = culler;
        this.weightedAverage = weightedAverage;
        this.medianCull = medianCull;
        this.mode = properties.getSynthesis().getMode();
        log.info("Location synthesis mode: {}", mode);
    }

    @Override
    public Optional<FusedLocation> synthesize(Collection<RfLocation> locations) {
        if (locations == null || locations.isEmpty()) {
            return Optional.empty();
        }
        return switch (mode) {
            case CULL -> culler.cull(locations).flatMap(weightedAverage::average);
            case MEDIAN_SAFE -> medianCull.medianCullSafe(locations);
            case NONE -> weightedAverage.average(locations);
        };
    }
}
