// =============================================================================
// AidRoute - Depot
// =============================================================================
package com.aidroute.router.model;

import lombok.NonNull;

/**
 * Start and end point of round-trip routes.
 */
public record Depot(@NonNull GeocodeResult location) {

    public Depot {
        if (!location.isMatched()) {
            throw new IllegalArgumentException("Depot must be a matched location, was " + location.getStatus());
        }
    }

    public Coordinate coordinate() {
        return location.getCoordinate();
    }
}
