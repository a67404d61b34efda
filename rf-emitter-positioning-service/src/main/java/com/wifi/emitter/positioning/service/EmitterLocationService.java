package com.wifi.emitter.positioning.service;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.notNullIsland;

import com.wifi.emitter.positioning.algorithm.LocationSynthesizer;
import com.wifi.emitter.positioning.cache.EmitterCache;
import com.wifi.emitter.positioning.dto.EmitterType;
import com.wifi.emitter.positioning.dto.FusedLocation;
import com.wifi.emitter.positioning.dto.Observation;
import com.wifi.emitter.positioning.dto.RfIdentification;
import com.wifi.emitter.positioning.dto.RfLocation;
import com.wifi.emitter.positioning.dto.TrustedFix;
import com.wifi.emitter.positioning.emitter.EmitterRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one reporting interval at a time: observations (with an optional trusted fix) flow in
 * through {@link #processObservations}, and {@link #completePeriod()} fuses everything seen since
 * the previous period into a location.
 *
 * <p>All record mutation happens on the caller's thread. Callers must use a single thread, which
 * {@link BackgroundProcessingService} provides.
 */
@Slf4j
@Service
public class EmitterLocationService {

    private final EmitterCache cache;
    private final LocationSynthesizer synthesizer;
    private final SignalStrengthCorrector signalStrengthCorrector;

    private final Set<RfIdentification> seenThisPeriod = new LinkedHashSet<>();

    private final Counter observationsAcceptedCounter;
    private final Counter observationsDroppedCounter;
    private final Counter fixesIgnoredCounter;
    private final Counter locationsReportedCounter;
    private final Timer periodTimer;

    public EmitterLocationService(
            EmitterCache cache,
            LocationSynthesizer synthesizer,
            SignalStrengthCorrector signalStrengthCorrector,
            MeterRegistry meterRegistry) {
        this.cache = cache;
        this.synthesizer = synthesizer;
        this.signalStrengthCorrector = signalStrengthCorrector;

        this.observationsAcceptedCounter = Counter.builder("emitter.observations.accepted")
                .description("Observations applied to emitter records")
                .register(meterRegistry);
        this.observationsDroppedCounter = Counter.builder("emitter.observations.dropped")
                .description("Malformed observations discarded")
                .register(meterRegistry);
        this.fixesIgnoredCounter = Counter.builder("emitter.fixes.ignored")
                .description("Trusted fixes ignored because they lie near null island")
                .register(meterRegistry);
        this.locationsReportedCounter = Counter.builder("emitter.locations.reported")
                .description("Periods that produced a fused location")
                .register(meterRegistry);
        this.periodTimer = Timer.builder("emitter.period.duration")
                .description("Time to project, sync and fuse one period")
                .register(meterRegistry);
    }

    /**
     * Processes one batch of observations from a scan.
     *
     * @param observations observations of one scan; malformed ones are dropped
     * @param fix trusted fix taken at scan time, or null when there is none
     */
    public void processObservations(Collection<Observation> observations, TrustedFix fix) {
        Map<RfIdentification, Observation> accepted = new LinkedHashMap<>();
        for (Observation observation : observations) {
            if (isWellFormed(observation)) {
                // a later observation of the same emitter replaces the earlier one
                accepted.put(observation.identification(), signalStrengthCorrector.correct(observation));
                observationsAcceptedCounter.increment();
            } else {
                observationsDroppedCounter.increment();
            }
        }
        if (accepted.isEmpty()) {
            log.debug("processObservations() - no usable observations in {}", observations.size());
            return;
        }

        cache.batchLoad(accepted.keySet());
        synchronized (seenThisPeriod) {
            seenThisPeriod.addAll(accepted.keySet());
        }

        List<EmitterRecord> observed = new ArrayList<>(accepted.size());
        for (Observation observation : accepted.values()) {
            EmitterRecord emitterRecord = cache.get(observation.identification());
            if (emitterRecord == null) {
                log.warn("processObservations() - emitter cache is closed, dropping {} observations", accepted.size());
                return;
            }
            emitterRecord.setLastObservation(observation);
            observed.add(emitterRecord);
        }

        if (fix == null) {
            return;
        }
        if (!notNullIsland(fix.latitude(), fix.longitude())) {
            log.debug("processObservations() - ignoring fix near null island");
            fixesIgnoredCounter.increment();
            return;
        }
        log.debug("processObservations() - updating {} emitters with fix accuracy {}", observed.size(), fix.accuracy());
        for (EmitterRecord emitterRecord : observed) {
            emitterRecord.updateLocation(fix);
        }
    }

    public void processObservations(Collection<Observation> observations) {
        processObservations(observations, null);
    }

    /**
     * Ends the current reporting interval: projects every emitter seen since the last call, writes
     * pending changes back and fuses the projections.
     *
     * @return fused location, or empty when nothing usable was seen
     */
    public Optional<FusedLocation> completePeriod() {
        List<RfIdentification> seen;
        synchronized (seenThisPeriod) {
            if (seenThisPeriod.isEmpty()) {
                log.debug("completePeriod() - no emitters seen");
                return Optional.empty();
            }
            seen = new ArrayList<>(seenThisPeriod);
        }

        Timer.Sample periodSample = Timer.start();
        try {
            cache.batchLoad(seen);
            List<RfLocation> locations = new ArrayList<>();
            for (RfIdentification id : seen) {
                EmitterRecord emitterRecord = cache.get(id);
                if (emitterRecord != null) {
                    emitterRecord.location().ifPresent(locations::add);
                }
            }
            // kept until here so a failed load leaves the period intact for the next call
            synchronized (seenThisPeriod) {
                seenThisPeriod.removeAll(seen);
            }
            log.debug("completePeriod() - {} locations for {} emitters", locations.size(), seen.size());

            cache.sync();

            if (locations.isEmpty()) {
                return Optional.empty();
            }
            Optional<FusedLocation> result = synthesizer.synthesize(locations)
                    .filter(location -> notNullIsland(location.latitude(), location.longitude()));
            if (result.isPresent()) {
                locationsReportedCounter.increment();
            } else {
                log.debug("completePeriod() - no location to report");
            }
            return result;
        } finally {
            periodSample.stop(periodTimer);
        }
    }

    public int seenCount() {
        synchronized (seenThisPeriod) {
            return seenThisPeriod.size();
        }
    }

    /**
     * Writes pending changes and releases the store.
     */
    @PreDestroy
    public void close() {
        log.info("Closing emitter location service");
        synchronized (seenThisPeriod) {
            seenThisPeriod.clear();
        }
        cache.close();
    }

    private static boolean isWellFormed(Observation observation) {
        return observation != null
                && observation.identification().type() != EmitterType.INVALID
                && !observation.identification().typeScopedId().isBlank();
    }
}
