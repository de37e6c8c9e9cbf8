// =============================================================================
// AidRoute - Geocode Candidate
// =============================================================================
package com.aidroute.router.service.geocode;

import com.aidroute.router.model.Coordinate;

/**
 * One place returned by the geocoding provider for a query.
 */
public record GeocodeCandidate(String displayName, Coordinate coordinate) {
}
