// =============================================================================
// AidRoute - Optimize Request DTO
// =============================================================================
package com.aidroute.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for routing already geocoded locations.
 */
@Data
public class OptimizeRequest {

    /**
     * Start and end point of every route. Routes are open-ended without one.
     */
    @Valid
    private LocationInput depot;

    @NotEmpty(message = "Locations are required")
    @Size(max = 500, message = "At most 500 locations per request")
    private List<@NotNull @Valid LocationInput> locations;

    /**
     * Upper bound on deliveries per route; the configured default when absent.
     */
    private Integer maxStopsPerRoute;

    private boolean useTripSolver = true;
}
