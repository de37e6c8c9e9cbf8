// =============================================================================
// AidRoute - OSRM Trip Response DTO
// =============================================================================
package com.aidroute.router.service.solver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Subset of the OSRM {@code /trip} service response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OsrmTripResponse {

    private String code;
    private String message;
    private List<Trip> trips;
    private List<Waypoint> waypoints;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Trip {

        /**
         * Meters.
         */
        private double distance;

        /**
         * Seconds.
         */
        private double duration;

        private List<Leg> legs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Leg {
        private double distance;
        private double duration;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Waypoint {

        /**
         * Position of this input coordinate within the trip.
         */
        @JsonProperty("waypoint_index")
        private Integer waypointIndex;

        @JsonProperty("trips_index")
        private Integer tripsIndex;
    }
}
