package com.wifi.emitter.positioning.dto;

import java.time.Instant;

/**
 * Location fused from the emitters seen during one reporting interval.
 *
 * @param latitude fused latitude
 * @param longitude fused longitude
 * @param accuracy estimated error radius in meters
 * @param time newest observation time among the sources
 * @param sourceCount number of emitter projections averaged
 */
public record FusedLocation(
        double latitude, double longitude, double accuracy, Instant time, int sourceCount) {

    public FusedLocation {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Invalid latitude value");
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Invalid longitude value");
        }
        if (accuracy < 0) {
            throw new IllegalArgumentException("Invalid accuracy value");
        }
    }
}
