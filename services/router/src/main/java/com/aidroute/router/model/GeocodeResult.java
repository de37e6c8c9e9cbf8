// =============================================================================
// AidRoute - Geocode Result
// =============================================================================
package com.aidroute.router.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of geocoding one {@link Address}. Failures are values: a result
 * that is not {@link GeocodeStatus#MATCHED} carries an {@code errorDetail}.
 * {@code OUT_OF_RADIUS} results still carry the nearest candidate that was
 * found so callers can tell "not found" from "found but excluded".
 */
@Value
@Builder(toBuilder = true)
public class GeocodeResult {

    @NonNull
    Address query;

    String displayName;

    /**
     * Candidate position; {@code null} for {@code NO_MATCH} and {@code ERROR}.
     */
    Coordinate coordinate;

    @NonNull
    GeocodeStatus status;

    String errorDetail;

    /**
     * Geodesic distance from the depot, when one was known at lookup time.
     */
    Double distanceFromDepotMiles;

    public static GeocodeResult matched(Address query, String displayName, Coordinate coordinate) {
        return GeocodeResult.builder()
                .query(query)
                .displayName(displayName)
                .coordinate(coordinate)
                .status(GeocodeStatus.MATCHED)
                .build();
    }

    public static GeocodeResult failed(Address query, GeocodeStatus status, String errorDetail) {
        return GeocodeResult.builder()
                .query(query)
                .status(status)
                .errorDetail(errorDetail)
                .build();
    }

    public boolean isMatched() {
        return status == GeocodeStatus.MATCHED;
    }
}
