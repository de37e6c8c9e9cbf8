// =============================================================================
// AidRoute - Address Input DTO
// =============================================================================
package com.aidroute.router.dto;

import com.aidroute.router.model.Address;
import com.aidroute.router.model.StopDetails;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * One address to geocode, with optional recipient details.
 */
@Data
public class AddressInput {

    /**
     * Address text sent to the geocoder. May be blank; blank addresses are
     * reported as not found.
     */
    @NotNull(message = "Address is required")
    private String address;

    /**
     * Label shown in exports instead of the cleaned-up address.
     */
    private String originalAddress;

    private String name;

    private String phone;

    private String householdSize;

    private String itemsNeeded;

    private String specialItems;

    private String notes;

    public Address toAddress() {
        return Address.builder()
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
    }
}
