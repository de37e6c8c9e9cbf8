// =============================================================================
// AidRoute - Nominatim Place DTO
// =============================================================================
package com.aidroute.router.service.geocode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One element of a Nominatim {@code /search} JSON response. Coordinates are
 * sent as strings and coerced by Jackson.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimPlace {

    private Double lat;

    private Double lon;

    @JsonProperty("display_name")
    private String displayName;
}
