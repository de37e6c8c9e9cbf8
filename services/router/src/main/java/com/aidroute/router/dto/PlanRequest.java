// =============================================================================
// AidRoute - Plan Request DTO
// =============================================================================
package com.aidroute.router.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Geocode-and-route request: the geocoding request plus routing options.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class PlanRequest extends GeocodeRequest {

    /**
     * Upper bound on deliveries per route; the configured default when absent.
     */
    private Integer maxStopsPerRoute;

    /**
     * Whether the external trip solver may be used.
     */
    private boolean useTripSolver = true;
}
