// =============================================================================
// AidRoute - Route Planning Service
// =============================================================================
package com.aidroute.router.service;

import com.aidroute.router.config.RoutingProperties;
import com.aidroute.router.error.RoutingErrorCode;
import com.aidroute.router.error.RoutingException;
import com.aidroute.router.model.Address;
import com.aidroute.router.model.Cluster;
import com.aidroute.router.model.Depot;
import com.aidroute.router.model.GeocodeResult;
import com.aidroute.router.model.RouteSet;
import com.aidroute.router.service.cluster.Clusterer;
import com.aidroute.router.service.geocode.Geocoder;
import com.aidroute.router.service.solver.RouteOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the pipeline stages in order: geocode, filter, cluster, optimize.
 *
 * <p>Only matched, non-depot locations are clustered. Addresses that did not
 * match, including those outside the radius, are carried through to the result
 * as unroutable so the caller sees every input accounted for.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutePlanningService {

    private final Geocoder geocoder;
    private final Clusterer clusterer;
    private final RouteOptimizer routeOptimizer;
    private final RoutingProperties properties;

    public List<GeocodeResult> geocode(List<Address> addresses, Integer depotIndex, Double radiusMiles) {
        return geocoder.geocode(addresses, depotIndex, radiusMiles);
    }

    /**
     * Geocode the addresses and route every one that matched.
     *
     * @throws RoutingException {@code NO_ROUTABLE_LOCATIONS} when no non-depot
     *                          address matched
     */
    public RouteSet planFromAddresses(List<Address> addresses, Integer depotIndex, Double radiusMiles,
                                      Integer maxStopsPerRoute, boolean useTripSolver) {
        long startTime = System.currentTimeMillis();
        int maxStops = resolveMaxStops(maxStopsPerRoute);

        List<GeocodeResult> results = geocoder.geocode(addresses, depotIndex, radiusMiles);

        GeocodeResult depotResult = null;
        List<GeocodeResult> routable = new ArrayList<>();
        List<GeocodeResult> unroutable = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            GeocodeResult result = results.get(i);
            if (depotIndex != null && i == depotIndex) {
                depotResult = result;
                if (!result.isMatched()) {
                    unroutable.add(result);
                }
            } else if (result.isMatched()) {
                routable.add(result);
            } else {
                unroutable.add(result);
            }
        }

        Depot depot = depotResult != null && depotResult.isMatched() ? new Depot(depotResult) : null;
        RouteSet routeSet = route(routable, depot, maxStops, useTripSolver, unroutable);

        log.info("Plan complete: addresses={}, routed={}, unroutable={}, routes={}, elapsedMs={}",
                addresses.size(), routable.size(), unroutable.size(), routeSet.routes().size(),
                System.currentTimeMillis() - startTime);
        return routeSet;
    }

    /**
     * Route already geocoded locations.
     *
     * @param locations matched locations to visit
     * @param depot     optional depot; routes are open-ended without one
     */
    public RouteSet planFromLocations(List<GeocodeResult> locations, GeocodeResult depot,
                                      Integer maxStopsPerRoute, boolean useTripSolver) {
        int maxStops = resolveMaxStops(maxStopsPerRoute);
        Depot anchor = depot != null ? new Depot(depot) : null;
        return route(locations, anchor, maxStops, useTripSolver, List.of());
    }

    private RouteSet route(List<GeocodeResult> routable, Depot depot, int maxStops, boolean useTripSolver,
                           List<GeocodeResult> unroutable) {
        if (routable.isEmpty()) {
            throw new RoutingException(RoutingErrorCode.NO_ROUTABLE_LOCATIONS,
                    unroutable.isEmpty()
                            ? RoutingErrorCode.NO_ROUTABLE_LOCATIONS.getDefaultMessage()
                            : "None of the " + unroutable.size() + " addresses could be geocoded");
        }

        List<Cluster> clusters = clusterer.cluster(routable, depot, maxStops);
        log.info("Clustering complete: stops={}, clusters={}, maxStopsPerRoute={}, depot={}",
                routable.size(), clusters.size(), maxStops, depot != null);

        RouteSet optimized = routeOptimizer.optimize(clusters, useTripSolver);
        return new RouteSet(optimized.routes(), optimized.failures(), unroutable, depot);
    }

    private int resolveMaxStops(Integer requested) {
        int maxStops = requested != null ? requested : properties.getOptimizer().getDefaultMaxStopsPerRoute();
        if (maxStops < 1) {
            throw new RoutingException(RoutingErrorCode.CLUSTER_CONFIG_INVALID,
                    "maxStopsPerRoute must be at least 1, was " + maxStops);
        }
        return maxStops;
    }
}
