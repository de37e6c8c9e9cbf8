// =============================================================================
// AidRoute - Geocode Request DTO
// =============================================================================
package com.aidroute.router.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for batch geocoding.
 */
@Data
public class GeocodeRequest {

    @NotEmpty(message = "Addresses are required")
    @Size(max = 500, message = "At most 500 addresses per request")
    private List<@NotNull @Valid AddressInput> addresses;

    /**
     * Position of the depot within {@code addresses}.
     */
    @PositiveOrZero(message = "Depot index cannot be negative")
    private Integer depotIndex;

    /**
     * Maximum distance from the depot in miles. Ignored without a depot.
     */
    @Positive(message = "Radius must be positive")
    private Double radiusMiles;
}
