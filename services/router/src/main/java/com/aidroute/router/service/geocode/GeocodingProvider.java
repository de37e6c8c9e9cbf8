// =============================================================================
// AidRoute - Geocoding Provider
// =============================================================================
package com.aidroute.router.service.geocode;

import java.util.List;

/**
 * External address search service. Implementations perform exactly one
 * outbound request per call and do no rate limiting of their own.
 */
public interface GeocodingProvider {

    /**
     * @param query free-text address
     * @param limit maximum number of candidates wanted
     * @return candidates in provider ranking order, empty when nothing matched
     * @throws GeocodingProviderException when the provider could not answer
     */
    List<GeocodeCandidate> search(String query, int limit) throws GeocodingProviderException;
}
