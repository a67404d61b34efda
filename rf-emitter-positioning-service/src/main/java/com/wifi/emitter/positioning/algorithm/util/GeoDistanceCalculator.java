package com.wifi.emitter.positioning.algorithm.util;

/**
 * Flat-earth helpers for the short distances (well under one degree) between an emitter and the
 * positions it is seen from.
 *
 * <p>Meters per degree varies from ~110500 at the equator to ~111700 at the poles for latitude and
 * is ~111300 for longitude at the equator. A single constant keeps the error around 1%, which is
 * far below the uncertainty of radio coverage.
 */
public final class GeoDistanceCalculator {

    public static final double DEG_TO_METER = 111_225.0;
    public static final double METER_TO_DEG = 1.0 / DEG_TO_METER;

    /** Floor for cos(latitude) wherever we divide by it. */
    public static final double MIN_COS = 0.01;

    /** Positions this close to (0, 0) are treated as a missing fix. */
    public static final double NULL_ISLAND_DISTANCE = 1_000.0;

    private static final double NULL_ISLAND_DISTANCE_DEG = NULL_ISLAND_DISTANCE * METER_TO_DEG;

    private GeoDistanceCalculator() {}

    /**
     * Planar approximation of the distance between two points, accurate to ~0.1% below one degree.
     *
     * @return distance in meters
     */
    public static double approximateDistance(double lat1, double lon1, double lat2, double lon2) {
        double distLat = lat1 - lat2;
        double distLon = (lon1 - lon2) * Math.cos(Math.toRadians(lat1));
        return Math.sqrt(distLat * distLat + distLon * distLon) * DEG_TO_METER;
    }

    /** Cosine of the latitude, floored at {@link #MIN_COS}. */
    public static double flooredCos(double latitude) {
        return Math.max(MIN_COS, Math.cos(Math.toRadians(latitude)));
    }

    /**
     * Checks whether a position is plausibly real rather than a (0, 0) placeholder. The degree test
     * avoids the distance computation in almost every case.
     */
    public static boolean notNullIsland(double latitude, double longitude) {
        return Math.abs(latitude) > NULL_ISLAND_DISTANCE_DEG
                || Math.abs(longitude) > NULL_ISLAND_DISTANCE_DEG
                || approximateDistance(latitude, longitude, 0.0, 0.0) > NULL_ISLAND_DISTANCE;
    }
}
