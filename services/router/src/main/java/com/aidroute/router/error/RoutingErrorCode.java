// =============================================================================
// AidRoute - Routing Error Codes
// =============================================================================
package com.aidroute.router.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy shared by every pipeline stage.
 */
@Getter
@RequiredArgsConstructor
public enum RoutingErrorCode {

    GEOCODE_NOT_FOUND(422, "Address could not be geocoded"),
    GEOCODE_OUT_OF_RADIUS(422, "Address is outside the service radius"),
    GEOCODE_PROVIDER_ERROR(502, "Geocoding provider failed"),
    CLUSTER_CONFIG_INVALID(400, "Invalid clustering configuration"),
    OPTIMIZE_PROVIDER_TIMEOUT(504, "Trip solver timed out"),
    OPTIMIZE_PROVIDER_ERROR(502, "Trip solver failed"),
    EXPORT_SERIALIZATION_ERROR(500, "Route export failed"),
    NO_ROUTABLE_LOCATIONS(422, "No successfully geocoded locations to route"),
    INVALID_REQUEST(400, "Invalid request");

    private final int httpStatus;
    private final String defaultMessage;
}
