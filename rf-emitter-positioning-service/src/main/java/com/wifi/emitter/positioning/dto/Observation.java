package com.wifi.emitter.positioning.dto;

import java.time.Instant;
import java.util.Objects;

/**
 * One sighting of one emitter in one scan. Consumed once by the processing cycle and never
 * persisted.
 *
 * @param identification the emitter seen
 * @param signalStrength ASU-like strength, clamped to [{@link #MINIMUM_SIGNAL}, {@link
 *     #MAXIMUM_SIGNAL}]
 * @param captureTime when the scan saw the emitter
 * @param label network name for WLAN, empty for cells
 * @param suspicious the collector distrusts this sighting, e.g. a repeated stale signal level
 */
public record Observation(
        RfIdentification identification,
        int signalStrength,
        Instant captureTime,
        String label,
        boolean suspicious) {

    public static final int MINIMUM_SIGNAL = 1;
    public static final int MAXIMUM_SIGNAL = 31;

    public Observation {
        Objects.requireNonNull(identification, "identification");
        Objects.requireNonNull(captureTime, "captureTime");
        signalStrength = clampSignal(signalStrength);
        label = label == null ? "" : label;
    }

    public Observation(RfIdentification identification, int signalStrength, Instant captureTime) {
        this(identification, signalStrength, captureTime, "", false);
    }

    public static int clampSignal(int signalStrength) {
        return Math.max(MINIMUM_SIGNAL, Math.min(MAXIMUM_SIGNAL, signalStrength));
    }

    public Observation withSignalStrength(int correctedSignalStrength) {
        return new Observation(identification, correctedSignalStrength, captureTime, label, suspicious);
    }
}
