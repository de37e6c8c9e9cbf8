// =============================================================================
// AidRoute - Route Plan Response DTO
// =============================================================================
package com.aidroute.router.dto;

import com.aidroute.router.model.ClusterFailure;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.Route;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.model.Stop;
import com.aidroute.router.service.export.GpxDocument;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for route planning.
 */
@Data
@Builder
public class RoutePlanResponse {

    /**
     * Unique plan ID.
     */
    private String planId;

    /**
     * Solution status.
     */
    private PlanStatus status;

    /**
     * Sum of route distances in miles.
     */
    private double totalDistanceMiles;

    /**
     * Deliveries across all routes, depot stops excluded.
     */
    private int totalStops;

    private List<RouteDto> routes;

    /**
     * Clusters no solver could route.
     */
    private List<FailureDto> failures;

    /**
     * Addresses that never reached clustering.
     */
    private List<GeocodeResponse.GeocodedAddress> unroutable;

    private SolverStats solverStats;

    private Instant timestamp;

    public enum PlanStatus {
        /**
         * Every input routed with the preferred solver.
         */
        COMPLETE,
        /**
         * Every cluster routed, some with a fallback solver.
         */
        DEGRADED,
        /**
         * Some clusters or addresses could not be routed.
         */
        PARTIAL
    }

    @Data
    @Builder
    public static class RouteDto {

        private int routeNumber;
        private String fileName;
        private boolean roundTrip;
        private int stopCount;
        private double totalDistanceMiles;
        private Double estimatedDurationMinutes;
        private String solver;
        private boolean degraded;
        private List<StopDto> stops;
    }

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StopDto {

        private int sequence;
        private boolean depot;
        private String address;
        private String displayName;
        private double latitude;
        private double longitude;
        private double distanceFromStartMiles;
        private String name;
        private String phone;
        private String householdSize;
        private String itemsNeeded;
    }

    @Data
    @Builder
    public static class FailureDto {

        private int clusterId;
        private String code;
        private String message;
        private List<String> addresses;
    }

    @Data
    @Builder
    public static class SolverStats {

        private long solveTimeMs;
        private int clusters;
        private int degradedRoutes;
        private String clusteringStrategy;
    }

    public static RoutePlanResponse from(RouteSet routeSet, long solveTimeMs, String clusteringStrategy) {
        List<RouteDto> routes = routeSet.routes().stream().map(RoutePlanResponse::toRouteDto).toList();
        List<FailureDto> failures = routeSet.failures().stream().map(RoutePlanResponse::toFailureDto).toList();
        List<GeocodeResponse.GeocodedAddress> unroutable = routeSet.unroutable().stream()
                .map(GeocodeResponse.GeocodedAddress::from)
                .toList();
        int degradedRoutes = (int) routeSet.routes().stream().filter(Route::isDegraded).count();

        PlanStatus status;
        if (!failures.isEmpty() || !unroutable.isEmpty()) {
            status = PlanStatus.PARTIAL;
        } else if (degradedRoutes > 0) {
            status = PlanStatus.DEGRADED;
        } else {
            status = PlanStatus.COMPLETE;
        }

        return RoutePlanResponse.builder()
                .planId(UUID.randomUUID().toString())
                .status(status)
                .totalDistanceMiles(Math.round(routeSet.totalDistanceMiles() * 100.0) / 100.0)
                .totalStops(routeSet.totalDeliveries())
                .routes(routes)
                .failures(failures)
                .unroutable(unroutable)
                .solverStats(SolverStats.builder()
                        .solveTimeMs(solveTimeMs)
                        .clusters(routes.size() + failures.size())
                        .degradedRoutes(degradedRoutes)
                        .clusteringStrategy(clusteringStrategy)
                        .build())
                .timestamp(Instant.now())
                .build();
    }

    private static RouteDto toRouteDto(Route route) {
        return RouteDto.builder()
                .routeNumber(route.getIndex())
                .fileName(GpxDocument.fileNameFor(route.getIndex()))
                .roundTrip(route.isRoundTrip())
                .stopCount(route.deliveryCount())
                .totalDistanceMiles(route.getTotalDistanceMiles())
                .estimatedDurationMinutes(route.getEstimatedDurationMinutes())
                .solver(route.getSolver())
                .degraded(route.isDegraded())
                .stops(route.getStops().stream().map(RoutePlanResponse::toStopDto).toList())
                .build();
    }

    private static StopDto toStopDto(Stop stop) {
        GeocodeResult location = stop.getLocation();
        return StopDto.builder()
                .sequence(stop.getSequenceNumber())
                .depot(stop.isDepot())
                .address(location.getQuery().label())
                .displayName(location.getDisplayName())
                .latitude(stop.coordinate().latitude())
                .longitude(stop.coordinate().longitude())
                .distanceFromStartMiles(stop.getDistanceFromStartMiles())
                .name(location.getQuery().getDetails().getName())
                .phone(location.getQuery().getDetails().getPhone())
                .householdSize(location.getQuery().getDetails().getHouseholdSize())
                .itemsNeeded(location.getQuery().getDetails().getItemsNeeded())
                .build();
    }

    private static FailureDto toFailureDto(ClusterFailure failure) {
        return FailureDto.builder()
                .clusterId(failure.clusterId())
                .code(failure.code().name())
                .message(failure.message())
                .addresses(failure.members().stream().map(member -> member.getQuery().label()).toList())
                .build();
    }
}
