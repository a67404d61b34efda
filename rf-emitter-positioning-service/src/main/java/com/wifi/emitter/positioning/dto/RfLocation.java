package com.wifi.emitter.positioning.dto;

import java.time.Instant;

/**
 * Point-in-time projection of one emitter's coverage, built for a single synthesis pass.
 *
 * @param identification emitter the projection belongs to
 * @param latitude coverage center
 * @param longitude coverage center
 * @param radius learned coverage radius in meters, may be 0
 * @param signalStrength signal of the most recent observation
 * @param suspicious whether the most recent observation is distrusted
 * @param time capture time of the most recent observation
 */
public record RfLocation(
        RfIdentification identification,
        double latitude,
        double longitude,
        double radius,
        int signalStrength,
        boolean suspicious,
        Instant time) {

    public EmitterType type() {
        return identification.type();
    }

    public RfCharacteristics characteristics() {
        return identification.type().characteristics();
    }

    /** Coverage radius, but never below the type's minimum range. */
    public double accuracyEstimate() {
        return Math.max(radius, characteristics().minimumRange());
    }

    public int minimumGroupSize() {
        return characteristics().minimumGroupSize();
    }
}
