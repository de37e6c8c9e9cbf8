// =============================================================================
// AidRoute - Geocoding Provider Exception
// =============================================================================
package com.aidroute.router.service.geocode;

import lombok.Getter;

/**
 * Provider call failed. {@code transientFailure} marks timeouts, connection
 * problems and server-side errors that are worth retrying.
 */
@Getter
public class GeocodingProviderException extends Exception {

    private final boolean transientFailure;

    public GeocodingProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public GeocodingProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }
}
