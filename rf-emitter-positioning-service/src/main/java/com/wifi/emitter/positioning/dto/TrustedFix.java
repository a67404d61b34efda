package com.wifi.emitter.positioning.dto;

import java.time.Instant;
import java.util.Objects;

/** A smoothed satellite position used to learn emitter coverage. Accuracy is in meters. */
public record TrustedFix(double latitude, double longitude, double accuracy, Instant captureTime) {

    public TrustedFix {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Invalid latitude value");
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Invalid longitude value");
        }
        if (accuracy < 0) {
            throw new IllegalArgumentException("Invalid accuracy value");
        }
        Objects.requireNonNull(captureTime, "captureTime");
    }
}
