// =============================================================================
// AidRoute - Geocode Response DTO
// =============================================================================
package com.aidroute.router.dto;

import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.GeocodeStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for batch geocoding. Results keep the request order.
 */
@Data
@Builder
public class GeocodeResponse {

    private List<GeocodedAddress> results;

    private int matched;

    private int noMatch;

    private int outOfRadius;

    private int errors;

    private Instant timestamp;

    public static GeocodeResponse from(List<GeocodeResult> results) {
        List<GeocodedAddress> entries = results.stream().map(GeocodedAddress::from).toList();
        return GeocodeResponse.builder()
                .results(entries)
                .matched(count(results, GeocodeStatus.MATCHED))
                .noMatch(count(results, GeocodeStatus.NO_MATCH))
                .outOfRadius(count(results, GeocodeStatus.OUT_OF_RADIUS))
                .errors(count(results, GeocodeStatus.ERROR))
                .timestamp(Instant.now())
                .build();
    }

    private static int count(List<GeocodeResult> results, GeocodeStatus status) {
        return (int) results.stream().filter(result -> result.getStatus() == status).count();
    }

    /**
     * Outcome for one address. Coordinates are present for matched and
     * out-of-radius results, {@code error} for everything but matches.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GeocodedAddress {

        private String address;
        private String originalAddress;
        private GeocodeStatus status;
        private String displayName;
        private Double latitude;
        private Double longitude;
        private Double distanceFromDepotMiles;
        private String error;
        private String name;
        private String phone;
        private String householdSize;
        private String itemsNeeded;
        private String specialItems;
        private String notes;

        static GeocodedAddress from(GeocodeResult result) {
            GeocodedAddressBuilder builder = GeocodedAddress.builder()
                    .address(result.getQuery().getText())
                    .originalAddress(result.getQuery().getOriginalAddress())
                    .status(result.getStatus())
                    .displayName(result.getDisplayName())
                    .distanceFromDepotMiles(result.getDistanceFromDepotMiles())
                    .error(result.getErrorDetail())
                    .name(result.getQuery().getDetails().getName())
                    .phone(result.getQuery().getDetails().getPhone())
                    .householdSize(result.getQuery().getDetails().getHouseholdSize())
                    .itemsNeeded(result.getQuery().getDetails().getItemsNeeded())
                    .specialItems(result.getQuery().getDetails().getSpecialItems())
                    .notes(result.getQuery().getDetails().getNotes());
            if (result.getCoordinate() != null) {
                builder.latitude(result.getCoordinate().latitude())
                        .longitude(result.getCoordinate().longitude());
            }
            return builder.build();
        }
    }
}
