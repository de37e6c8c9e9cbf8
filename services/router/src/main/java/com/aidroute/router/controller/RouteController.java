// =============================================================================
// AidRoute - Route Controller
// =============================================================================
package com.aidroute.router.controller;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.dto.AddressInput;
import com.aidroute.router.dto.GeocodeRequest;
import com.aidroute.router.dto.GeocodeResponse;
import com.aidroute.router.dto.LocationInput;
import com.aidroute.router.dto.OptimizeRequest;
import com.aidroute.router.dto.PlanRequest;
import com.aidroute.router.dto.RoutePlanResponse;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.service.RoutePlanningService;
import com.aidroute.router.service.export.ExportBundle;
import com.aidroute.router.service.export.RouteExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * REST controller for geocoding, route planning and export endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
@Tag(name = "Delivery Routing", description = "Geocoding, clustering and route planning endpoints")
public class RouteController {

    static final String ARCHIVE_FILE_NAME = "delivery_routes.zip";

    private final RoutePlanningService planningService;
    private final RouteExporter routeExporter;
    private final RoutingProperties properties;

    /**
     * Geocode a batch of addresses.
     *
     * @param request addresses with optional depot index and radius
     * @return one result per address in request order
     */
    @PostMapping("/geocode")
    @Operation(
            summary = "Geocode addresses",
            description = "Resolves addresses to coordinates, reporting each failure without aborting the batch"
    )
    public ResponseEntity<GeocodeResponse> geocode(@Valid @RequestBody GeocodeRequest request) {
        log.info("Geocode request: addresses={}, depotIndex={}, radiusMiles={}",
                request.getAddresses().size(), request.getDepotIndex(), request.getRadiusMiles());

        List<GeocodeResult> results = planningService.geocode(
                toAddresses(request.getAddresses()), request.getDepotIndex(), request.getRadiusMiles());

        return ResponseEntity.ok(GeocodeResponse.from(results));
    }

    /**
     * Route already geocoded locations.
     *
     * @param request locations, optional depot and route size limit
     * @return routes in cluster order plus any per-cluster failures
     */
    @PostMapping("/optimize")
    @Operation(
            summary = "Optimize routes",
            description = "Clusters geocoded locations and orders each cluster using the trip solver "
                    + "or the nearest-neighbor fallback"
    )
    public ResponseEntity<RoutePlanResponse> optimize(@Valid @RequestBody OptimizeRequest request) {
        log.info("Optimize request: locations={}, depot={}, maxStopsPerRoute={}, useTripSolver={}",
                request.getLocations().size(), request.getDepot() != null,
                request.getMaxStopsPerRoute(), request.isUseTripSolver());

        long startTime = System.currentTimeMillis();
        RouteSet routeSet = optimizeLocations(request);

        return ResponseEntity.ok(RoutePlanResponse.from(
                routeSet, System.currentTimeMillis() - startTime, clusteringStrategy()));
    }

    /**
     * Geocode addresses and route every match in one call.
     *
     * @param request addresses plus routing options
     * @return routes, cluster failures and the addresses that could not be geocoded
     */
    @PostMapping("/plan")
    @Operation(
            summary = "Plan routes from addresses",
            description = "Geocodes, filters by radius, clusters and optimizes in a single request"
    )
    public ResponseEntity<RoutePlanResponse> plan(@Valid @RequestBody PlanRequest request) {
        log.info("Plan request: addresses={}, depotIndex={}, radiusMiles={}, maxStopsPerRoute={}",
                request.getAddresses().size(), request.getDepotIndex(),
                request.getRadiusMiles(), request.getMaxStopsPerRoute());

        long startTime = System.currentTimeMillis();
        RouteSet routeSet = planningService.planFromAddresses(
                toAddresses(request.getAddresses()),
                request.getDepotIndex(),
                request.getRadiusMiles(),
                request.getMaxStopsPerRoute(),
                request.isUseTripSolver());

        return ResponseEntity.ok(RoutePlanResponse.from(
                routeSet, System.currentTimeMillis() - startTime, clusteringStrategy()));
    }

    /**
     * Route geocoded locations and download the GPX files and manifests.
     *
     * @param request locations, optional depot and route size limit
     * @return ZIP archive with one GPX file per route plus text and JSON manifests
     */
    @PostMapping(value = "/export", produces = "application/zip")
    @Operation(
            summary = "Export routes",
            description = "Optimizes the locations and returns route_NN.gpx files, manifest.txt "
                    + "and route_manifest.json as a ZIP archive"
    )
    public ResponseEntity<byte[]> export(@Valid @RequestBody OptimizeRequest request) {
        log.info("Export request: locations={}, depot={}", request.getLocations().size(), request.getDepot() != null);

        ExportBundle bundle = routeExporter.export(optimizeLocations(request));
        byte[] archive = routeExporter.archive(bundle);

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("application/zip"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(ARCHIVE_FILE_NAME).build().toString())
                .body(archive);
    }

    /**
     * Health check endpoint.
     *
     * @return Health status
     */
    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check routing service health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", "Routing service is running"));
    }

    private RouteSet optimizeLocations(OptimizeRequest request) {
        List<GeocodeResult> locations = request.getLocations().stream()
                .map(LocationInput::toGeocodeResult)
                .toList();
        GeocodeResult depot = request.getDepot() != null ? request.getDepot().toGeocodeResult() : null;
        return planningService.planFromLocations(
                locations, depot, request.getMaxStopsPerRoute(), request.isUseTripSolver());
    }

    private static List<Address> toAddresses(List<AddressInput> inputs) {
        return inputs.stream().map(AddressInput::toAddress).toList();
    }

    private String clusteringStrategy() {
        return properties.getClustering().getStrategy().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Simple health response.
     */
    public record HealthResponse(String status, String message) {}
}
