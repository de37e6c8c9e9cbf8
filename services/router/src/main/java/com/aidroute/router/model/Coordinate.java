// =============================================================================
// AidRoute - Coordinate
// =============================================================================
package com.aidroute.router.model;

/**
 * WGS-84 position in decimal degrees.
 */
public record Coordinate(double latitude, double longitude) {

    public Coordinate {
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }
}
