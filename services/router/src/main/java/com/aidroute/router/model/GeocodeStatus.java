// =============================================================================
// AidRoute - Geocode Status
// =============================================================================
package com.aidroute.router.model;

public enum GeocodeStatus {
    MATCHED,
    NO_MATCH,
    OUT_OF_RADIUS,
    ERROR
}
