// =============================================================================
// AidRoute - Address
// =============================================================================
package com.aidroute.router.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Free-text address as supplied by the caller.
 */
@Value
@Builder
public class Address {

    /**
     * Text sent to the geocoding provider.
     */
    @NonNull
    String text;

    /**
     * Display label passed through untouched, e.g. the spreadsheet cell the
     * text was cleaned up from.
     */
    String originalAddress;

    @Builder.Default
    StopDetails details = StopDetails.EMPTY;

    public static Address of(String text) {
        return Address.builder().text(text).build();
    }

    public String label() {
        return originalAddress != null && !originalAddress.isBlank() ? originalAddress : text;
    }
}
