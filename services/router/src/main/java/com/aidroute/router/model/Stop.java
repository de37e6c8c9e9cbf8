// =============================================================================
// AidRoute - Stop
// =============================================================================
package com.aidroute.router.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A location at a fixed position within a {@link Route}.
 */
@Value
@Builder
public class Stop {

    int sequenceNumber;

    @NonNull
    GeocodeResult location;

    /**
     * True for the opening and closing depot stops of a round trip.
     */
    boolean depot;

    /**
     * Geodesic distance from the first stop of the route.
     */
    double distanceFromStartMiles;

    public Coordinate coordinate() {
        return location.getCoordinate();
    }
}
