package com.wifi.emitter.positioning.emitter;

import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.DEG_TO_METER;
import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.METER_TO_DEG;
import static com.wifi.emitter.positioning.algorithm.util.GeoDistanceCalculator.flooredCos;

/**
 * Smallest axis-aligned rectangle (in degrees) containing every trusted position an emitter was
 * seen from, exposed as a center and two radii in meters.
 *
 * <p>The box only ever grows. An empty box starts with impossible extents so the first update
 * always expands it.
 */
public final class CoverageBox {

    private double north = -91.0;
    private double south = 91.0;
    private double east = -181.0;
    private double west = 181.0;

    private double centerLat;
    private double centerLon;
    private double radiusNs;
    private double radiusEw;
    private double radius;

    private CoverageBox() {}

    public static CoverageBox empty() {
        return new CoverageBox();
    }

    public static CoverageBox ofPoint(double latitude, double longitude) {
        CoverageBox box = new CoverageBox();
        box.update(latitude, longitude);
        return box;
    }

    /** Box centered on a position whose true location is only known within {@code accuracy}. */
    public static CoverageBox aroundPoint(double latitude, double longitude, double accuracy) {
        return ofCenter(latitude, longitude, accuracy, accuracy);
    }

    /**
     * Rebuilds a box from a saved center and radii.
     *
     * @throws IllegalArgumentException if either radius is negative
     */
    public static CoverageBox ofCenter(
            double centerLat, double centerLon, double radiusNs, double radiusEw) {
        if (radiusNs < 0 || radiusEw < 0) {
            throw new IllegalArgumentException("radii cannot be < 0");
        }
        CoverageBox box = new CoverageBox();
        box.centerLat = centerLat;
        box.centerLon = centerLon;
        box.radiusNs = radiusNs;
        box.radiusEw = radiusEw;
        box.radius = Math.hypot(radiusNs, radiusEw);

        box.north = centerLat + radiusNs * METER_TO_DEG;
        box.south = centerLat - radiusNs * METER_TO_DEG;
        double cosLat = flooredCos(centerLat);
        box.east = centerLon + radiusEw * METER_TO_DEG / cosLat;
        box.west = centerLon - radiusEw * METER_TO_DEG / cosLat;
        return box;
    }

    /**
     * Expands the box to include a position.
     *
     * @return whether the box changed
     */
    public boolean update(double latitude, double longitude) {
        boolean updated = false;
        if (latitude > north) {
            north = latitude;
            updated = true;
        }
        if (latitude < south) {
            south = latitude;
            updated = true;
        }
        if (longitude > east) {
            east = longitude;
            updated = true;
        }
        if (longitude < west) {
            west = longitude;
            updated = true;
        }
        if (updated) {
            centerLat = (north + south) / 2.0;
            centerLon = (east + west) / 2.0;
            radiusNs = (north - centerLat) * DEG_TO_METER;
            radiusEw = (east - centerLon) * DEG_TO_METER * flooredCos(centerLat);
            radius = Math.hypot(radiusNs, radiusEw);
        }
        return updated;
    }

    /** Strict inclusion test; points on an edge are outside. */
    public boolean contains(double latitude, double longitude) {
        return north > latitude && south < latitude && east > longitude && west < longitude;
    }

    public boolean isEmpty() {
        return north < south;
    }

    public double north() {
        return north;
    }

    public double south() {
        return south;
    }

    public double east() {
        return east;
    }

    public double west() {
        return west;
    }

    public double centerLat() {
        return centerLat;
    }

    public double centerLon() {
        return centerLon;
    }

    public double radiusNs() {
        return radiusNs;
    }

    public double radiusEw() {
        return radiusEw;
    }

    public double radius() {
        return radius;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoverageBox)) {
            return false;
        }
        CoverageBox other = (CoverageBox) o;
        return centerLat == other.centerLat
                && centerLon == other.centerLon
                && radiusNs == other.radiusNs
                && radiusEw == other.radiusEw;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(centerLat);
        result = 31 * result + Double.hashCode(centerLon);
        result = 31 * result + Double.hashCode(radiusNs);
        return 31 * result + Double.hashCode(radiusEw);
    }

    @Override
    public String toString() {
        return String.format(
                "CoverageBox[n=%f, w=%f, s=%f, e=%f, center=(%f, %f), rNs=%.1f, rEw=%.1f, r=%.1f]",
                north, west, south, east, centerLat, centerLon, radiusNs, radiusEw, radius);
    }
}
