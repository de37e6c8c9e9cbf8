// =============================================================================
// AidRoute - Stop Details
// =============================================================================
package com.aidroute.router.model;

import lombok.Builder;
import lombok.Value;

/**
 * Recipient information carried alongside an address for display in
 * waypoints and manifests. Never used for routing decisions.
 */
@Value
@Builder
public class StopDetails {

    public static final StopDetails EMPTY = StopDetails.builder().build();

    String name;
    String phone;
    String householdSize;
    String itemsNeeded;
    String specialItems;
    String notes;
}
