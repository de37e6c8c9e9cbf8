// =============================================================================
// AidRoute - Location Input DTO
// =============================================================================
package com.aidroute.router.dto;

import com.aidroute.router.model.Address;
import com.aidroute.router.model.Coordinate;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.StopDetails;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * An already geocoded location.
 */
@Data
public class LocationInput {

    @NotBlank(message = "Address is required")
    private String address;

    private String originalAddress;

    private String displayName;

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double longitude;

    private String name;

    private String phone;

    private String householdSize;

    private String itemsNeeded;

    private String specialItems;

    private String notes;

    public GeocodeResult toGeocodeResult() {
        Address query = Address.builder()
                .text(address)
                .originalAddress(originalAddress)
                .details(StopDetails.builder()
                        .name(name)
                        .phone(phone)
                        .householdSize(householdSize)
                        .itemsNeeded(itemsNeeded)
                        .specialItems(specialItems)
                        .notes(notes)
                        .build())
                .build();
        return GeocodeResult.matched(query, displayName != null ? displayName : address,
                Coordinate.of(latitude, longitude));
    }
}
