package com.wifi.emitter.positioning.dto;

/**
 * Static modelling constants for one family of radio emitters.
 *
 * @param requiredFixAccuracy worst trusted-fix accuracy (meters) accepted for learning coverage
 * @param minimumRange smallest coverage radius (meters) we are willing to report
 * @param maximumRange largest believable coverage radius (meters); beyond it the emitter moved
 * @param minimumGroupSize emitters of this type needed in a culled group before fusing a location
 */
public record RfCharacteristics(
        double requiredFixAccuracy, double minimumRange, double maximumRange, int minimumGroupSize) {}
