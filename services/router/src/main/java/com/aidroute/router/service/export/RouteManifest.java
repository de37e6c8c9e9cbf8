// =============================================================================
// AidRoute - Route Manifest
// =============================================================================
package com.aidroute.router.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured manifest consumed by downstream tooling such as packing-slip
 * generation.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"depotAddress", "totalRoutes", "totalStops", "totalDistanceMiles", "routes", "failures",
        "unroutable"})
public class RouteManifest {

    String depotAddress;
    int totalRoutes;
    int totalStops;
    double totalDistanceMiles;
    List<RouteEntry> routes;
    List<FailureEntry> failures;
    List<UnroutableEntry> unroutable;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"routeNumber", "fileName", "stopCount", "totalDistanceMiles", "estimatedDurationMinutes",
            "solver", "degraded", "stops"})
    public static class RouteEntry {
        int routeNumber;
        String fileName;
        int stopCount;
        double totalDistanceMiles;
        Double estimatedDurationMinutes;
        String solver;
        boolean degraded;
        List<StopEntry> stops;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"sequence", "name", "phone", "address", "displayName", "latitude", "longitude",
            "distanceFromStartMiles", "householdSize", "itemsNeeded", "specialItems", "notes"})
    public static class StopEntry {
        int sequence;
        String name;
        String phone;
        String address;
        String displayName;
        double latitude;
        double longitude;
        double distanceFromStartMiles;
        String householdSize;
        String itemsNeeded;
        String specialItems;
        String notes;
    }

    @Value
    @Builder
    @JsonPropertyOrder({"clusterId", "code", "message", "addresses"})
    public static class FailureEntry {
        int clusterId;
        String code;
        String message;
        List<String> addresses;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"address", "status", "error"})
    public static class UnroutableEntry {
        String address;
        String status;
        String error;
    }
}
